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

package co.fastcrypt.config;

import co.fastcrypt.crypto.CryptoException;
import com.typesafe.config.Config;

/**
 * Wraps the {@code crypto} section of the configuration.
 */
public class CryptoConfig {

    public static final String PROPERTY_LIBRARY = "crypto.library";
    public static final String PROPERTY_KDF_ITERATIONS = "crypto.kdf.iterations";
    public static final String PROPERTY_KDF_LENGTH = "crypto.kdf.length";
    public static final String PROPERTY_BENCHMARK_SIZE = "crypto.benchmark.size";
    public static final String PROPERTY_BENCHMARK_ITERATIONS = "crypto.benchmark.iterations";

    private final String library;
    private final int kdfIterations;
    private final int kdfLength;
    private final int benchmarkSize;
    private final int benchmarkIterations;

    public CryptoConfig(String library, int kdfIterations, int kdfLength, int benchmarkSize, int benchmarkIterations) {
        if (kdfIterations < 1) {
            throw CryptoException.invalidArgument(PROPERTY_KDF_ITERATIONS + " must be at least 1: " + kdfIterations);
        }
        if (kdfLength < 0) {
            throw CryptoException.invalidArgument(PROPERTY_KDF_LENGTH + " cannot be negative: " + kdfLength);
        }
        if (benchmarkSize < 0) {
            throw CryptoException.invalidArgument(PROPERTY_BENCHMARK_SIZE + " cannot be negative: " + benchmarkSize);
        }
        if (benchmarkIterations < 1) {
            throw CryptoException.invalidArgument(PROPERTY_BENCHMARK_ITERATIONS + " must be at least 1: " + benchmarkIterations);
        }
        this.library = library;
        this.kdfIterations = kdfIterations;
        this.kdfLength = kdfLength;
        this.benchmarkSize = benchmarkSize;
        this.benchmarkIterations = benchmarkIterations;
    }

    public String library() {
        return library;
    }

    public int kdfIterations() {
        return kdfIterations;
    }

    public int kdfLength() {
        return kdfLength;
    }

    public int benchmarkSize() {
        return benchmarkSize;
    }

    public int benchmarkIterations() {
        return benchmarkIterations;
    }

    /**
     * Reads configuration in the form of
     * { crypto: { library: string, kdf: { iterations: int, length: int }, benchmark: { size: int, iterations: int } } }
     */
    public static CryptoConfig fromConfig(Config config) {
        return new CryptoConfig(
                config.getString(PROPERTY_LIBRARY),
                config.getInt(PROPERTY_KDF_ITERATIONS),
                config.getInt(PROPERTY_KDF_LENGTH),
                config.getInt(PROPERTY_BENCHMARK_SIZE),
                config.getInt(PROPERTY_BENCHMARK_ITERATIONS)
        );
    }

    @Override
    public String toString() {
        return String.format("CryptoConfig{library=%s, kdfIterations=%d, kdfLength=%d, benchmarkSize=%d, benchmarkIterations=%d}",
                library, kdfIterations, kdfLength, benchmarkSize, benchmarkIterations);
    }
}
