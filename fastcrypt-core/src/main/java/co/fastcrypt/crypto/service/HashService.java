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

package co.fastcrypt.crypto.service;

/**
 * Service in charge of the hashing functionality.
 * Functions:
 * - SHA-256 digest
 * - HMAC-SHA256
 * - PBKDF2-HMAC-SHA256 key derivation
 *
 * <p>Every implementation is stateless and produces bit-for-bit the same output
 * as any other. Invalid requests are rejected with a
 * {@link co.fastcrypt.crypto.CryptoException} before any work is done.</p>
 */
public interface HashService {

    /**
     * @return the value of {@code crypto.library} that selects this implementation
     */
    String getName();

    /**
     * @return the 32-byte SHA-256 digest of {@code length} bytes of {@code data} starting at {@code offset}
     */
    byte[] sha256(byte[] data, int offset, int length);

    default byte[] sha256(byte[] data) {
        return sha256(data, 0, data == null ? 0 : data.length);
    }

    /**
     * @return the 32-byte HMAC-SHA256 of {@code message} under {@code key}
     */
    byte[] hmacSha256(byte[] key, byte[] message);

    /**
     * Derives {@code outputLength} bytes from a password and salt. An iteration count of
     * 0 is treated as 1.
     */
    byte[] pbkdf2(byte[] password, byte[] salt, int iterations, int outputLength);

    /**
     * @return the largest {@code outputLength} accepted by {@link #pbkdf2}
     */
    long maxDerivedKeyLength();
}
