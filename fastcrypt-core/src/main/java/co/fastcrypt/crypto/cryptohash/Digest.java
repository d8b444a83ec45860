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

/**
 * A streaming hash function. Data is fed with the {@code update} methods,
 * then {@link #digest()} pads, completes the computation and returns the result.
 * An instance is owned by a single caller; it is not thread-safe.
 */
public interface Digest {

    void update(byte in);

    void update(byte[] in);

    void update(byte[] in, int off, int len);

    /**
     * Finishes the computation. The instance then rejects further input
     * until {@link #reset()} is called.
     */
    byte[] digest();

    /**
     * Shorthand for {@code update(in)} followed by {@link #digest()}.
     */
    byte[] digest(byte[] in);

    void reset();

    int getDigestLength();

    int getBlockLength();
}
