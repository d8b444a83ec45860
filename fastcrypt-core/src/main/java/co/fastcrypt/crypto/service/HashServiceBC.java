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

import co.fastcrypt.crypto.CryptoException;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import static co.fastcrypt.crypto.CryptoPreconditions.checkBuffer;
import static co.fastcrypt.crypto.CryptoPreconditions.checkNonNegative;
import static co.fastcrypt.crypto.CryptoPreconditions.checkRange;

/**
 * Implementation of HashService with Bouncy Castle.
 */
class HashServiceBC implements HashService {

    static final String NAME = "bc";

    /**
     * {@link PKCS5S2ParametersGenerator} takes the key size in bits as an int.
     */
    private static final long MAX_OUTPUT_LENGTH = Integer.MAX_VALUE / 8;

    /**
     * Part of the Singleton hash service.
     * {@link HashServices#getInstance()}
     */
    HashServiceBC() {
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public byte[] sha256(byte[] data, int offset, int length) {
        checkRange(data, offset, length, "data");
        Digest digest = new SHA256Digest();
        byte[] out = new byte[digest.getDigestSize()];
        digest.update(data, offset, length);
        digest.doFinal(out, 0);
        return out;
    }

    @Override
    public byte[] hmacSha256(byte[] key, byte[] message) {
        checkBuffer(key, "key");
        checkBuffer(message, "message");
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(message, 0, message.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    @Override
    public byte[] pbkdf2(byte[] password, byte[] salt, int iterations, int outputLength) {
        checkBuffer(password, "password");
        checkBuffer(salt, "salt");
        checkNonNegative(iterations, "iterations");
        checkNonNegative(outputLength, "outputLength");
        if (outputLength > MAX_OUTPUT_LENGTH) {
            throw CryptoException.requestTooLarge(outputLength, MAX_OUTPUT_LENGTH);
        }
        if (outputLength == 0) {
            return new byte[0];
        }

        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(password, salt, Math.max(iterations, 1));
        KeyParameter key = (KeyParameter) generator.generateDerivedMacParameters(outputLength * 8);
        return key.getKey();
    }

    @Override
    public long maxDerivedKeyLength() {
        return MAX_OUTPUT_LENGTH;
    }
}
