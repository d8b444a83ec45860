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

import static co.fastcrypt.crypto.CryptoPreconditions.checkBuffer;
import static co.fastcrypt.crypto.CryptoPreconditions.checkNonNegative;

/**
 * PBKDF2 (RFC 8018, section 5.2) with HMAC-SHA256 as the pseudorandom function.
 *
 * <p>Output block {@code n} (counting from 1) is {@code U1 ^ U2 ^ ... ^ Uc} where
 * {@code U1 = HMAC(P, S || INT_32_BE(n))} and {@code Uj = HMAC(P, U(j-1))}.
 * Blocks are concatenated and the last one is truncated to the requested length.</p>
 *
 * <p>An iteration count of 0 is treated as 1. The rounds of one block depend on each
 * other and run sequentially; independent derivations can run in parallel.</p>
 */
public final class Pbkdf2HmacSha256 {

    private static final int H_LEN = HmacSha256.MAC_LENGTH;

    /**
     * The block counter is 32 bits, and the result has to fit in a Java array.
     */
    public static final long MAX_OUTPUT_LENGTH = Math.min(0xFFFFFFFFL * H_LEN, Integer.MAX_VALUE - 8L);

    private Pbkdf2HmacSha256() {
        throw new IllegalStateException("Utility class");
    }

    public static byte[] derive(byte[] password, byte[] salt, int iterations, int outputLength) {
        checkBuffer(password, "password");
        checkBuffer(salt, "salt");
        checkNonNegative(iterations, "iterations");
        checkNonNegative(outputLength, "outputLength");
        if (outputLength > MAX_OUTPUT_LENGTH) {
            throw CryptoException.requestTooLarge(outputLength, MAX_OUTPUT_LENGTH);
        }
        int rounds = Math.max(iterations, 1);

        HmacSha256 prf = new HmacSha256(password);
        byte[] out = new byte[outputLength];
        byte[] block = new byte[salt.length + 4];
        System.arraycopy(salt, 0, block, 0, salt.length);
        byte[] t = new byte[H_LEN];

        int blocks = (int) ((outputLength + (long) H_LEN - 1) / H_LEN);
        for (int blockIndex = 1; blockIndex <= blocks; blockIndex++) {
            int off = (blockIndex - 1) * H_LEN;
            writeInt32BE(blockIndex, block, salt.length);
            byte[] u = prf.mac(block);
            System.arraycopy(u, 0, t, 0, H_LEN);

            for (int j = 2; j <= rounds; j++) {
                u = prf.mac(u);
                for (int k = 0; k < H_LEN; k++) {
                    t[k] ^= u[k];
                }
            }

            System.arraycopy(t, 0, out, off, Math.min(H_LEN, outputLength - off));
        }
        return out;
    }

    private static void writeInt32BE(int value, byte[] buf, int off) {
        buf[off] = (byte) (value >>> 24);
        buf[off + 1] = (byte) (value >>> 16);
        buf[off + 2] = (byte) (value >>> 8);
        buf[off + 3] = (byte) value;
    }
}
