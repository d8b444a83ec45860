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

import java.security.MessageDigest;
import java.util.Arrays;

import static co.fastcrypt.crypto.CryptoPreconditions.checkBuffer;
import static co.fastcrypt.crypto.cryptohash.Sha256Constants.BLOCK_LENGTH;

/**
 * HMAC-SHA256 (RFC 2104) bound to a single key.
 *
 * <p>The key is normalized once: keys longer than the 64-byte block are replaced
 * by their SHA-256 hash, then the key is zero-extended to 64 bytes. The inner and
 * outer pads are absorbed into two prefix states at construction; every
 * {@link #mac(byte[])} call works on copies of those, so the instance is immutable
 * and may be shared between threads.</p>
 */
public final class HmacSha256 {

    public static final int MAC_LENGTH = Sha256Constants.DIGEST_LENGTH;

    private static final byte IPAD = 0x36;
    private static final byte OPAD = 0x5C;

    private final Sha256Digest innerPrefix;
    private final Sha256Digest outerPrefix;

    public HmacSha256(byte[] key) {
        byte[] keyBlock = normalizeKey(checkBuffer(key, "key"));
        byte[] innerPad = new byte[BLOCK_LENGTH];
        byte[] outerPad = new byte[BLOCK_LENGTH];
        for (int i = 0; i < BLOCK_LENGTH; i++) {
            innerPad[i] = (byte) (keyBlock[i] ^ IPAD);
            outerPad[i] = (byte) (keyBlock[i] ^ OPAD);
        }

        innerPrefix = new Sha256Digest();
        innerPrefix.update(innerPad);
        outerPrefix = new Sha256Digest();
        outerPrefix.update(outerPad);

        Arrays.fill(keyBlock, (byte) 0);
        Arrays.fill(innerPad, (byte) 0);
        Arrays.fill(outerPad, (byte) 0);
    }

    /**
     * @return {@code SHA256(outerPad || SHA256(innerPad || message))}
     */
    public byte[] mac(byte[] message) {
        return mac(checkBuffer(message, "message"), 0, message.length);
    }

    public byte[] mac(byte[] message, int off, int len) {
        Sha256Digest inner = new Sha256Digest(innerPrefix);
        inner.update(message, off, len);
        Sha256Digest outer = new Sha256Digest(outerPrefix);
        outer.update(inner.digest());
        return outer.digest();
    }

    /**
     * Computes the MAC of {@code message} and compares it with {@code expectedMac}
     * in time independent of where the two differ.
     */
    public boolean verify(byte[] message, byte[] expectedMac) {
        checkBuffer(expectedMac, "expectedMac");
        return MessageDigest.isEqual(mac(message), expectedMac);
    }

    /**
     * Hashes keys longer than a block, then zero-pads to exactly one block.
     */
    static byte[] normalizeKey(byte[] key) {
        byte[] shortKey = key.length > BLOCK_LENGTH ? new Sha256Digest().digest(key) : key;
        return Arrays.copyOf(shortKey, BLOCK_LENGTH);
    }
}
