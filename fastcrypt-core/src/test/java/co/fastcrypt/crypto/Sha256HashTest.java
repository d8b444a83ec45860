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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

class Sha256HashTest {

    private static final String ABC = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void testSha256Hash() {
        Sha256Hash hash = Sha256Hash.of("abc".getBytes(StandardCharsets.US_ASCII));
        Sha256Hash hash2 = new Sha256Hash(ABC);
        Sha256Hash hash3 = new Sha256Hash("0x" + ABC.toUpperCase());
        Sha256Hash other = Sha256Hash.of(new byte[0]);

        Assertions.assertEquals(ABC, hash.toHexString());
        Assertions.assertEquals(ABC, hash.toString());
        Assertions.assertEquals(hash, hash2);
        Assertions.assertEquals(hash, hash3);
        Assertions.assertEquals(hash.hashCode(), hash2.hashCode());
        Assertions.assertNotEquals(hash, other);
        Assertions.assertNotEquals(null, hash);
        Assertions.assertNotEquals(ABC, hash);
    }

    @Test
    void testBytesAreCopied() {
        byte[] raw = new byte[32];
        Sha256Hash hash = new Sha256Hash(raw);
        raw[0] = 1;
        hash.getBytes()[1] = 1;
        Assertions.assertArrayEquals(new byte[32], hash.getBytes());
    }

    @Test
    void testWrongLength() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Sha256Hash(new byte[31]));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Sha256Hash("abcd"));
    }
}
