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
import co.fastcrypt.crypto.service.HashService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Measures SHA-256 throughput of a {@link HashService} over a random buffer.
 */
public class HashBenchmark {

    private static final Logger logger = LoggerFactory.getLogger(HashBenchmark.class);

    private final HashService hashService;
    private final Random random;

    public HashBenchmark(HashService hashService) {
        this(hashService, new SecureRandom());
    }

    public HashBenchmark(HashService hashService, Random random) {
        this.hashService = hashService;
        this.random = random;
    }

    public Result run(int dataSize, int iterations) {
        if (dataSize < 0) {
            throw CryptoException.invalidArgument("dataSize cannot be negative: " + dataSize);
        }
        if (iterations < 1) {
            throw CryptoException.invalidArgument("iterations must be at least 1: " + iterations);
        }

        byte[] data = new byte[dataSize];
        random.nextBytes(data);

        logger.debug("START [{}] {} x {} bytes", hashService.getName(), iterations, dataSize);
        long start = System.nanoTime();
        for (int i = 0; i < iterations; i++) {
            hashService.sha256(data);
        }
        long elapsed = System.nanoTime() - start;

        Result result = new Result(hashService.getName(), dataSize, iterations, elapsed);
        logger.info("END [{}] {} x {} bytes. Duration: {}ms ({}ns), {} MB/s",
                result.getLibrary(), iterations, dataSize,
                Math.round(elapsed / 1_000_000d), elapsed, String.format("%.2f", result.getMegabytesPerSecond()));
        return result;
    }

    public static class Result {
        private final String library;
        private final int dataSize;
        private final int iterations;
        private final long durationNano;

        public Result(String library, int dataSize, int iterations, long durationNano) {
            this.library = library;
            this.dataSize = dataSize;
            this.iterations = iterations;
            this.durationNano = durationNano;
        }

        public String getLibrary() {
            return library;
        }

        public int getDataSize() {
            return dataSize;
        }

        public int getIterations() {
            return iterations;
        }

        public long getDurationNano() {
            return durationNano;
        }

        public double getSeconds() {
            return durationNano / 1_000_000_000d;
        }

        public double getMegabytesPerSecond() {
            if (durationNano <= 0) {
                return 0d;
            }
            return ((double) dataSize * iterations) / (1024d * 1024d) / getSeconds();
        }
    }
}
