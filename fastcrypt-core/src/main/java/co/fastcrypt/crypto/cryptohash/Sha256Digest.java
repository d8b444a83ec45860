/*
 * This file is part of FastCrypt
 * Copyright (C) 2026 FastCrypt contributors.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.fastcrypt.crypto.cryptohash;

import co.fastcrypt.crypto.CryptoException;
import com.google.common.annotations.VisibleForTesting;

import java.util.Arrays;

import static co.fastcrypt.crypto.CryptoPreconditions.checkBuffer;
import static co.fastcrypt.crypto.CryptoPreconditions.checkRange;
import static co.fastcrypt.crypto.cryptohash.Sha256Constants.BLOCK_LENGTH;
import static co.fastcrypt.crypto.cryptohash.Sha256Constants.DIGEST_LENGTH;
import static com.google.common.base.Preconditions.checkState;

/**
 * Streaming SHA-256 (FIPS 180-4). Input may be fed in chunks of any size;
 * the result only depends on the concatenation of the chunks.
 *
 * <p>An instance is either accumulating (after construction or {@link #reset()})
 * or finalized (after {@link #digest()}). A finalized instance rejects input
 * until it is reset.</p>
 */
public class Sha256Digest implements Digest {

    /**
     * The bit length of the message must fit in 64 bits.
     */
    public static final long MAX_INPUT_BYTES = (1L << 61) - 1;

    private final int[] h = new int[Sha256BlockHasher.STATE_WORDS];
    private final int[] w = new int[Sha256BlockHasher.SCHEDULE_WORDS];
    private final byte[] buffer = new byte[BLOCK_LENGTH];
    private int bufferLength;
    private long byteCount;
    private boolean finalized;

    public Sha256Digest() {
        reset();
    }

    /**
     * Copies the running state of {@code other}, which must still be accumulating.
     */
    public Sha256Digest(Sha256Digest other) {
        checkState(!other.finalized, "Cannot copy a finalized digest");
        System.arraycopy(other.h, 0, h, 0, h.length);
        System.arraycopy(other.buffer, 0, buffer, 0, other.bufferLength);
        bufferLength = other.bufferLength;
        byteCount = other.byteCount;
    }

    /**
     * Starts with {@code byteCount} bytes already accounted for, so the length
     * limit can be reached without feeding that much data.
     */
    @VisibleForTesting
    Sha256Digest(long byteCount) {
        this();
        this.byteCount = byteCount;
    }

    @Override
    public void update(byte in) {
        checkAccumulating();
        checkCapacity(1);
        buffer[bufferLength++] = in;
        byteCount++;
        if (bufferLength == BLOCK_LENGTH) {
            Sha256BlockHasher.compress(h, buffer, 0, w);
            bufferLength = 0;
        }
    }

    @Override
    public void update(byte[] in) {
        update(checkBuffer(in, "input"), 0, in.length);
    }

    @Override
    public void update(byte[] in, int off, int len) {
        checkRange(in, off, len, "input");
        checkAccumulating();
        checkCapacity(len);
        byteCount += len;

        if (bufferLength > 0) {
            int take = Math.min(len, BLOCK_LENGTH - bufferLength);
            System.arraycopy(in, off, buffer, bufferLength, take);
            bufferLength += take;
            off += take;
            len -= take;
            if (bufferLength < BLOCK_LENGTH) {
                return;
            }
            Sha256BlockHasher.compress(h, buffer, 0, w);
            bufferLength = 0;
        }

        // whole blocks straight from the caller's array
        while (len >= BLOCK_LENGTH) {
            Sha256BlockHasher.compress(h, in, off, w);
            off += BLOCK_LENGTH;
            len -= BLOCK_LENGTH;
        }

        System.arraycopy(in, off, buffer, 0, len);
        bufferLength = len;
    }

    @Override
    public byte[] digest() {
        checkAccumulating();
        long bitLength = byteCount << 3;

        buffer[bufferLength++] = (byte) 0x80;
        if (bufferLength > BLOCK_LENGTH - 8) {
            zeroFill(BLOCK_LENGTH);
            Sha256BlockHasher.compress(h, buffer, 0, w);
            bufferLength = 0;
        }
        zeroFill(BLOCK_LENGTH - 8);
        for (int i = 0; i < 8; i++) {
            buffer[BLOCK_LENGTH - 1 - i] = (byte) (bitLength >>> (8 * i));
        }
        Sha256BlockHasher.compress(h, buffer, 0, w);
        bufferLength = 0;
        finalized = true;

        byte[] out = new byte[DIGEST_LENGTH];
        for (int i = 0; i < h.length; i++) {
            int v = h[i];
            out[4 * i] = (byte) (v >>> 24);
            out[4 * i + 1] = (byte) (v >>> 16);
            out[4 * i + 2] = (byte) (v >>> 8);
            out[4 * i + 3] = (byte) v;
        }
        return out;
    }

    @Override
    public byte[] digest(byte[] in) {
        update(in);
        return digest();
    }

    @Override
    public final void reset() {
        System.arraycopy(Sha256Constants.IV, 0, h, 0, h.length);
        Arrays.fill(buffer, (byte) 0);
        bufferLength = 0;
        byteCount = 0;
        finalized = false;
    }

    @Override
    public int getDigestLength() {
        return DIGEST_LENGTH;
    }

    @Override
    public int getBlockLength() {
        return BLOCK_LENGTH;
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * @return the number of bytes absorbed since the last reset
     */
    public long getByteCount() {
        return byteCount;
    }

    @Override
    public String toString() {
        return "SHA-256";
    }

    private void zeroFill(int limit) {
        while (bufferLength < limit) {
            buffer[bufferLength++] = 0;
        }
    }

    private void checkAccumulating() {
        checkState(!finalized, "Digest already finalized; call reset() before reuse");
    }

    private void checkCapacity(int len) {
        if (len > MAX_INPUT_BYTES - byteCount) {
            throw CryptoException.unsupportedLength(byteCount + len);
        }
    }
}
