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

/**
 * Raised by the hashing, MAC and key derivation entry points when a request is rejected.
 * All checks are done before any processing starts, so no partial output is ever produced.
 */
public class CryptoException extends RuntimeException {

    private static final long serialVersionUID = 2164879513458961823L;

    public enum ErrorKind {
        /** A required buffer is missing, or a count, offset or length is out of range. */
        INVALID_ARGUMENT,
        /** The total digest input would overflow the 64-bit bit-length counter. */
        UNSUPPORTED_LENGTH,
        /** The requested derived key length cannot be produced. */
        REQUEST_TOO_LARGE
    }

    private final ErrorKind kind;

    public CryptoException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CryptoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static CryptoException invalidArgument(String message) {
        return new CryptoException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static CryptoException invalidArgument(String message, Throwable cause) {
        return new CryptoException(ErrorKind.INVALID_ARGUMENT, message, cause);
    }

    public static CryptoException unsupportedLength(long totalBytes) {
        return new CryptoException(ErrorKind.UNSUPPORTED_LENGTH,
                String.format("Digest input of %d bytes exceeds the 2^61 - 1 byte limit", totalBytes));
    }

    public static CryptoException requestTooLarge(long requested, long max) {
        return new CryptoException(ErrorKind.REQUEST_TOO_LARGE,
                String.format("Requested derived key length %d exceeds the maximum of %d bytes", requested, max));
    }
}
