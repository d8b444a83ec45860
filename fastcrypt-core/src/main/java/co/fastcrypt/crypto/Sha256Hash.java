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

import co.fastcrypt.util.HexUtils;
import com.google.common.primitives.Ints;

import java.io.Serializable;
import java.security.MessageDigest;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable SHA-256 digest or HMAC-SHA256 tag.
 */
public final class Sha256Hash implements Serializable {
    public static final int HASH_LEN = 32;
    private static final long serialVersionUID = 7516938412765904361L;

    private final byte[] bytes;

    public Sha256Hash(byte[] rawHashBytes) {
        checkArgument(rawHashBytes.length == HASH_LEN, "hash must be %s bytes, got %s", HASH_LEN, rawHashBytes.length);
        this.bytes = rawHashBytes.clone();
    }

    public Sha256Hash(String hexString) {
        this(HexUtils.decode(hexString));
    }

    public static Sha256Hash of(byte[] data) {
        return new Sha256Hash(HashUtil.sha256(data));
    }

    public String toHexString() {
        return HexUtils.toHexString(bytes);
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Compares in constant time, so this is safe for MAC checks.
     */
    @Override
    public boolean equals(Object o) {
        return this == o || o != null && getClass() == o.getClass() && MessageDigest.isEqual(bytes, ((Sha256Hash) o).bytes);
    }

    @Override
    public int hashCode() {
        return Ints.fromBytes(bytes[28], bytes[29], bytes[30], bytes[31]);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}
