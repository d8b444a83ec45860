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

import javax.annotation.Nullable;

/**
 * Boundary checks shared by every entry point. Failures are reported as
 * {@link CryptoException} with {@link CryptoException.ErrorKind#INVALID_ARGUMENT}.
 */
public final class CryptoPreconditions {

    private CryptoPreconditions() {
        throw new IllegalStateException("Utility class");
    }

    public static byte[] checkBuffer(@Nullable byte[] buffer, String name) {
        if (buffer == null) {
            throw CryptoException.invalidArgument(name + " cannot be null");
        }
        return buffer;
    }

    public static void checkRange(@Nullable byte[] buffer, int offset, int length, String name) {
        checkBuffer(buffer, name);
        if (offset < 0 || length < 0 || offset > buffer.length - length) {
            throw CryptoException.invalidArgument(String.format(
                    "Invalid range [%d, %d) for %s of length %d", offset, (long) offset + length, name, buffer.length));
        }
    }

    public static int checkNonNegative(int value, String name) {
        if (value < 0) {
            throw CryptoException.invalidArgument(name + " cannot be negative: " + value);
        }
        return value;
    }
}
