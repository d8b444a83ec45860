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

import co.fastcrypt.crypto.cryptohash.HmacSha256;
import co.fastcrypt.crypto.cryptohash.Pbkdf2HmacSha256;
import co.fastcrypt.crypto.cryptohash.Sha256Digest;

/**
 * Implementation of HashService with the engines in {@code co.fastcrypt.crypto.cryptohash}.
 */
class HashServiceJava implements HashService {

    static final String NAME = "java";

    /**
     * Part of the Singleton hash service.
     * {@link HashServices#getInstance()}
     */
    HashServiceJava() {
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public byte[] sha256(byte[] data, int offset, int length) {
        Sha256Digest digest = new Sha256Digest();
        digest.update(data, offset, length);
        return digest.digest();
    }

    @Override
    public byte[] hmacSha256(byte[] key, byte[] message) {
        return new HmacSha256(key).mac(message);
    }

    @Override
    public byte[] pbkdf2(byte[] password, byte[] salt, int iterations, int outputLength) {
        return Pbkdf2HmacSha256.derive(password, salt, iterations, outputLength);
    }

    @Override
    public long maxDerivedKeyLength() {
        return Pbkdf2HmacSha256.MAX_OUTPUT_LENGTH;
    }
}
