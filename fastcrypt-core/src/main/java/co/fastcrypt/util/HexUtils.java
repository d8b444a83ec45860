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

package co.fastcrypt.util;

import co.fastcrypt.crypto.CryptoException;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Locale;

public class HexUtils {

    public static final String HEX_PREFIX = "0x";

    private HexUtils() {
        throw new IllegalStateException("Utility class");
    }

    public static String toHexString(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    /**
     * Decodes an even-length hex string, with or without a {@code 0x} prefix.
     */
    public static byte[] decode(String hex) {
        if (hex == null) {
            throw CryptoException.invalidArgument("hex string cannot be null");
        }
        String digits = hex.toLowerCase(Locale.ROOT).startsWith(HEX_PREFIX) ? hex.substring(2) : hex;
        if (digits.length() % 2 != 0) {
            throw CryptoException.invalidArgument("hex string must have an even number of digits: " + hex);
        }
        try {
            return Hex.decodeStrict(digits);
        } catch (DecoderException e) {
            throw CryptoException.invalidArgument("invalid hex string: " + hex, e);
        }
    }
}
