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

import java.util.Arrays;

import static co.fastcrypt.crypto.cryptohash.Sha256Constants.BLOCK_LENGTH;
import static co.fastcrypt.crypto.cryptohash.Sha256Constants.K;

/**
 * The SHA-256 compression function: one 64-byte block folded into the
 * eight 32-bit chaining words. No buffering, no padding.
 */
public final class Sha256BlockHasher {

    public static final int STATE_WORDS = 8;
    public static final int SCHEDULE_WORDS = 64;

    private Sha256BlockHasher() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * @return a fresh copy of the initial chaining value
     */
    public static int[] initialState() {
        return Sha256Constants.IV.clone();
    }

    /**
     * Returns the state that results from compressing {@code block} into {@code state}.
     * Neither argument is modified.
     *
     * @param state the current eight chaining words
     * @param block exactly 64 bytes
     * @return the next eight chaining words
     */
    public static int[] next(int[] state, byte[] block) {
        if (state.length != STATE_WORDS) {
            throw new IllegalArgumentException("state must have " + STATE_WORDS + " words");
        }
        if (block.length != BLOCK_LENGTH) {
            throw new IllegalArgumentException("block must be " + BLOCK_LENGTH + " bytes");
        }
        int[] h = Arrays.copyOf(state, STATE_WORDS);
        compress(h, block, 0, new int[SCHEDULE_WORDS]);
        return h;
    }

    /**
     * Compresses the 64 bytes of {@code block} starting at {@code off} into {@code h}.
     * The state vector provided as the first parameter is modified by the function.
     *
     * @param h     the eight chaining words
     * @param block source of the block
     * @param off   start of the block within {@code block}
     * @param w     scratch space for the 64-word message schedule
     */
    static void compress(int[] h, byte[] block, int off, int[] w) {
        for (int t = 0; t < 16; t++, off += 4) {
            w[t] = (block[off] << 24)
                    | ((block[off + 1] & 0xFF) << 16)
                    | ((block[off + 2] & 0xFF) << 8)
                    | (block[off + 3] & 0xFF);
        }
        for (int t = 16; t < SCHEDULE_WORDS; t++) {
            w[t] = smallSigma1(w[t - 2]) + w[t - 7] + smallSigma0(w[t - 15]) + w[t - 16];
        }

        int a = h[0];
        int b = h[1];
        int c = h[2];
        int d = h[3];
        int e = h[4];
        int f = h[5];
        int g = h[6];
        int hh = h[7];

        for (int t = 0; t < 64; t++) {
            int t1 = hh + bigSigma1(e) + ch(e, f, g) + K[t] + w[t];
            int t2 = bigSigma0(a) + maj(a, b, c);
            hh = g;
            g = f;
            f = e;
            e = d + t1;
            d = c;
            c = b;
            b = a;
            a = t1 + t2;
        }

        // int addition wraps modulo 2^32
        h[0] += a;
        h[1] += b;
        h[2] += c;
        h[3] += d;
        h[4] += e;
        h[5] += f;
        h[6] += g;
        h[7] += hh;
    }

    private static int ch(int x, int y, int z) {
        return (x & y) ^ (~x & z);
    }

    private static int maj(int x, int y, int z) {
        return (x & y) ^ (x & z) ^ (y & z);
    }

    private static int bigSigma0(int x) {
        return Integer.rotateRight(x, 2) ^ Integer.rotateRight(x, 13) ^ Integer.rotateRight(x, 22);
    }

    private static int bigSigma1(int x) {
        return Integer.rotateRight(x, 6) ^ Integer.rotateRight(x, 11) ^ Integer.rotateRight(x, 25);
    }

    private static int smallSigma0(int x) {
        return Integer.rotateRight(x, 7) ^ Integer.rotateRight(x, 18) ^ (x >>> 3);
    }

    private static int smallSigma1(int x) {
        return Integer.rotateRight(x, 17) ^ Integer.rotateRight(x, 19) ^ (x >>> 10);
    }
}
