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

package co.fastcrypt.crypto;

import co.fastcrypt.crypto.service.HashServices;
import co.fastcrypt.util.HexUtils;

import javax.annotation.Nonnull;

/**
 * Entry point for hashing, message authentication and key derivation.
 * Every call goes to the service selected by {@link HashServices}.
 */
public class HashUtil {

    public static final int HASH_LENGTH = Sha256Hash.HASH_LEN;

    private HashUtil() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * @param input - data for hashing
     * @return - sha256 hash of the data
     */
    public static byte[] sha256(byte[] input) {
        return HashServices.getInstance().sha256(input);
    }

    /**
     * hashing chunk of the data
     * @param input - data for hash
     * @param start - start of hashing chunk
     * @param length - length of hashing chunk
     * @return - sha256 hash of the chunk
     */
    public static byte[] sha256(byte[] input, int start, int length) {
        return HashServices.getInstance().sha256(input, start, length);
    }

    /**
     * @see #doubleSha256(byte[], int, int)
     */
    public static byte[] doubleSha256(byte[] input) {
        CryptoPreconditions.checkBuffer(input, "input");
        return doubleSha256(input, 0, input.length);
    }

    /**
     * Calculates the SHA-256 hash of the given byte range, and then hashes the resulting hash again.
     */
    public static byte[] doubleSha256(byte[] input, int offset, int length) {
        return sha256(sha256(input, offset, length));
    }

    /**
     * @param key - MAC key, of any length
     * @param message - data to authenticate
     * @return - HMAC-SHA256 of the message
     */
    public static byte[] hmacSha256(byte[] key, byte[] message) {
        return HashServices.getInstance().hmacSha256(key, message);
    }

    /**
     * PBKDF2 with HMAC-SHA256.
     *
     * @param password - the password bytes
     * @param salt - the salt bytes
     * @param iterations - iteration count, 0 is treated as 1
     * @param outputLength - number of bytes to derive
     * @return - derived key of exactly {@code outputLength} bytes
     */
    public static byte[] pbkdf2(byte[] password, byte[] salt, int iterations, int outputLength) {
        return HashServices.getInstance().pbkdf2(password, salt, iterations, outputLength);
    }

    /**
     * Converts {@code hash} in a form of byte array to {@code String}
     * that's suitable to be printed out in a text form.
     */
    @Nonnull
    public static String toPrintableHash(@Nonnull final byte[] hash) {
        return HexUtils.toHexString(hash);
    }
}
