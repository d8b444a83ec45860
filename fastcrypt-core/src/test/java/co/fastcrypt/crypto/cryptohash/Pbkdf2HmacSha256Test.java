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
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class Pbkdf2HmacSha256Test {

    private static final byte[] PASSWORD = ascii("password");
    private static final byte[] SALT = ascii("salt");

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void oneIteration() {
        assertEquals("120fb6cffcf8b32c43e7225256c4f837a86548c92ccc35480805987cb70be17b",
                Hex.toHexString(Pbkdf2HmacSha256.derive(PASSWORD, SALT, 1, 32)));
    }

    @Test
    void twoIterations() {
        assertEquals("ae4d0c95af6b46d32d0adff928f06dd02a303f8ef3c251dfd6e2d85a95474c43",
                Hex.toHexString(Pbkdf2HmacSha256.derive(PASSWORD, SALT, 2, 32)));
    }

    @Test
    void manyIterations() {
        assertEquals("c5e478d59288c841aa530db6845c4c8d962893a001ce4e11a4963873aa98134a",
                Hex.toHexString(Pbkdf2HmacSha256.derive(PASSWORD, SALT, 4096, 32)));
    }

    @Test
    void multiBlockOutputWithTruncatedTail() {
        byte[] key = Pbkdf2HmacSha256.derive(
                ascii("passwordPASSWORDpassword"), ascii("saltSALTsaltSALTsaltSALTsaltSALTsalt"), 4096, 40);
        assertEquals("348c89dbcbd32b2f32d814b8116e84cf2b17347ebc1800181c4e2a1fb8dd53e1c635518c7dac47e9",
                Hex.toHexString(key));
    }

    @Test
    void embeddedZeroBytes() {
        byte[] key = Pbkdf2HmacSha256.derive(ascii("pass\0word"), ascii("sa\0lt"), 4096, 16);
        assertEquals("89b69d0516f829893c696226650a8687", Hex.toHexString(key));
    }

    @Test
    void zeroIterationsBehavesLikeOne() {
        assertArrayEquals(Pbkdf2HmacSha256.derive(PASSWORD, SALT, 1, 48), Pbkdf2HmacSha256.derive(PASSWORD, SALT, 0, 48));
    }

    @Test
    void firstBlockIsHmacOfSaltAndCounter() {
        byte[] saltAndCounter = Arrays.copyOf(SALT, SALT.length + 4);
        saltAndCounter[saltAndCounter.length - 1] = 1;
        assertArrayEquals(new HmacSha256(PASSWORD).mac(saltAndCounter), Pbkdf2HmacSha256.derive(PASSWORD, SALT, 1, 32));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 16, 31, 32, 33, 63, 64, 65, 100})
    void outputHasRequestedLengthAndSharesPrefix(int length) {
        byte[] longKey = Pbkdf2HmacSha256.derive(PASSWORD, SALT, 3, 100);
        byte[] key = Pbkdf2HmacSha256.derive(PASSWORD, SALT, 3, length);
        assertEquals(length, key.length);
        assertArrayEquals(Arrays.copyOf(longKey, length), key);
    }

    @Test
    void deterministic() {
        assertArrayEquals(Pbkdf2HmacSha256.derive(PASSWORD, SALT, 5, 70), Pbkdf2HmacSha256.derive(PASSWORD, SALT, 5, 70));
    }

    @Test
    void emptyPasswordAndSalt() {
        assertEquals(32, Pbkdf2HmacSha256.derive(new byte[0], new byte[0], 2, 32).length);
    }

    @Test
    void invalidArguments() {
        assertEquals(CryptoException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(CryptoException.class, () -> Pbkdf2HmacSha256.derive(null, SALT, 1, 32)).getKind());
        assertEquals(CryptoException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(CryptoException.class, () -> Pbkdf2HmacSha256.derive(PASSWORD, null, 1, 32)).getKind());
        assertEquals(CryptoException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(CryptoException.class, () -> Pbkdf2HmacSha256.derive(PASSWORD, SALT, -1, 32)).getKind());
        assertEquals(CryptoException.ErrorKind.INVALID_ARGUMENT,
                assertThrows(CryptoException.class, () -> Pbkdf2HmacSha256.derive(PASSWORD, SALT, 1, -1)).getKind());
    }

    @Test
    void oversizedRequestIsRejectedBeforeWork() {
        CryptoException e = assertThrows(CryptoException.class,
                () -> Pbkdf2HmacSha256.derive(PASSWORD, SALT, Integer.MAX_VALUE, Integer.MAX_VALUE));
        assertEquals(CryptoException.ErrorKind.REQUEST_TOO_LARGE, e.getKind());
    }
}
