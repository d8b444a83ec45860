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

import co.fastcrypt.config.CryptoConfig;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Class in charge of being the access point to implementations of all the hashing functionality.
 * It returns an instance of {@link HashService}.
 * Is implemented as a Singleton, so the only way to access an instance is through getInstance().
 */
public final class HashServices {

    private static final Logger logger = LoggerFactory.getLogger("crypto");

    private static volatile HashService instance = new HashServiceJava();
    private static boolean initialized = false;

    private HashServices() {
    }

    /**
     * <p> It should be called only once at startup.</p>
     *
     * <p> It reads the "crypto.library" property to decide which impl to initialize.</p>
     *
     * <p> By default it initializes the Java impl.</p>
     *
     * @param cryptoConfig could be null in tests
     */
    public static synchronized void initialize(@Nullable CryptoConfig cryptoConfig) {
        if (initialized) {
            logger.warn("Hash service was already initialized. This could be either for duplicate initialization or calling to getInstance before init.");
        } else {
            initialized = true;
        }
        if (cryptoConfig == null) {
            logger.warn("Empty crypto config.");
            return;
        }
        instance = create(cryptoConfig.library());
        logger.debug("Hash service initialized: {}.", instance.getName());
    }

    /**
     * As a singleton this should be the only entry point for obtaining the configured HashService.
     *
     * @return either {@link HashServiceJava} or {@link HashServiceBC}
     */
    public static HashService getInstance() {
        return instance;
    }

    /**
     * @return a new service for {@code library}, falling back to the Java impl for unknown names
     */
    public static HashService create(String library) {
        String name = library == null ? "" : library.trim().toLowerCase(Locale.ROOT);
        if (HashServiceBC.NAME.equals(name)) {
            return new HashServiceBC();
        }
        if (!HashServiceJava.NAME.equals(name)) {
            logger.warn("Unknown crypto library '{}', initializing {}.", library, HashServiceJava.NAME);
        }
        return new HashServiceJava();
    }

    @VisibleForTesting
    static synchronized void reset() {
        instance = new HashServiceJava();
        initialized = false;
    }
}
