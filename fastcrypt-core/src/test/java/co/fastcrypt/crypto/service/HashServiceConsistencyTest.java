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
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Both backends must agree bit for bit and reject the same requests.
 */
class HashServiceConsistencyTest {

    private final HashService javaService = new HashServiceJava();
    private final HashService bcService = new HashServiceBC();

    static Stream<Arguments> services() {
        return Stream.of(Arguments.of(new HashServiceJava()), Arguments.of(new HashServiceBC()));
    }

    @Test
    void sha256Agrees() {
        Random random = new Random(7);
        for (int i = 0; i < 40; i++) {
            byte[] data = new byte[random.nextInt(300)];
            random.nextBytes(data);
            int offset = data.length == 0 ? 0 : random.nextInt(data.length);
            int length = data.length - offset;
            assertArrayEquals(bcService.sha256(data), javaService.sha256(data));
            assertArrayEquals(bcService.sha256(data, offset, length), javaService.sha256(data, offset, length));
        }
    }

    @Test
    void hmacAgrees() {
        Random random = new Random(11);
        for (int i = 0; i < 40; i++) {
            byte[] key = new byte[random.nextInt(150)];
            byte[] message = new byte[random.nextInt(200)];
            random.nextBytes(key);
            random.nextBytes(message);
            assertArrayEquals(bcService.hmacSha256(key, message), javaService.hmacSha256(key, message));
        }
    }

    @Test
    void pbkdf2Agrees() {
        Random random = new Random(13);
        for (int i = 0; i < 20; i++) {
            byte[] password = new byte[random.nextInt(80)];
            byte[] salt = new byte[random.nextInt(40)];
            random.nextBytes(password);
            random.nextBytes(salt);
            int iterations = random.nextInt(20);
            int length = random.nextInt(100);
            assertArrayEquals(bcService.pbkdf2(password, salt, iterations, length), javaService.pbkdf2(password, salt, iterations, length));
        }
    }

    @ParameterizedTest
    @MethodSource("services")
    void publishedVectors(HashService service) {
        byte[] hiThereKey = new byte[20];
        Arrays.fill(hiThereKey, (byte) 0x0b);

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                Hex.toHexString(service.sha256(new byte[0])));
        assertEquals("b0344c61d8db38535ca8afceaf0bf12b881dc200c9833da726e9376c2e32cff7",
                Hex.toHexString(service.hmacSha256(hiThereKey, "Hi There".getBytes(StandardCharsets.US_ASCII))));
        assertEquals("120fb6cffcf8b32c43e7225256c4f837a86548c92ccc35480805987cb70be17b",
                Hex.toHexString(service.pbkdf2("password".getBytes(StandardCharsets.US_ASCII),
                        "salt".getBytes(StandardCharsets.US_ASCII), 1, 32)));
    }

    @ParameterizedTest
    @MethodSource("services")
    void rejectsInvalidRequests(HashService service) {
        assertKind(CryptoException.ErrorKind.INVALID_ARGUMENT, () -> service.sha256(null));
        assertKind(CryptoException.ErrorKind.INVALID_ARGUMENT, () -> service.sha256(new byte[3], 2, 2));
        assertKind(CryptoException.ErrorKind.INVALID_ARGUMENT, () -> service.hmacSha256(null, new byte[0]));
        assertKind(CryptoException.ErrorKind.INVALID_ARGUMENT, () -> service.hmacSha256(new byte[0], null));
        assertKind(CryptoException.ErrorKind.INVALID_ARGUMENT, () -> service.pbkdf2(null, new byte[0], 1, 1));
        assertKind(CryptoException.ErrorKind.INVALID_ARGUMENT, () -> service.pbkdf2(new byte[0], new byte[0], -5, 1));
        assertKind(CryptoException.ErrorKind.REQUEST_TOO_LARGE,
                () -> service.pbkdf2(new byte[0], new byte[0], 1, (int) Math.min(Integer.MAX_VALUE, service.maxDerivedKeyLength() + 1)));
    }

    private static void assertKind(CryptoException.ErrorKind kind, Executable executable) {
        assertEquals(kind, assertThrows(CryptoException.class, executable).getKind());
    }
}
