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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.File;

/**
 * Class that encapsulates config loading strategy.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger("config");

    public static final String PROPERTY_CONFIG_FILE = "fastcrypt.conf.file";

    private final Config overrides;
    @Nullable
    private final File userFile;

    public ConfigLoader(Config overrides, @Nullable File userFile) {
        this.overrides = overrides;
        this.userFile = userFile;
    }

    /**
     * Loader for a regular process: system properties override the file named by
     * {@value #PROPERTY_CONFIG_FILE}, if any.
     */
    public static ConfigLoader fromSystemProperties() {
        String path = System.getProperty(PROPERTY_CONFIG_FILE);
        return new ConfigLoader(ConfigFactory.systemProperties(), path == null ? null : new File(path));
    }

    /**
     * Loads configurations from different sources with the following precedence:
     * 1. Overrides (system properties, command line)
     * 2. User configuration file
     * 3. Default settings in resources/reference.conf
     */
    public Config getConfig() {
        Config userConfig = ConfigFactory.empty();
        if (userFile != null) {
            if (userFile.canRead()) {
                logger.info("Loading user configuration from {}", userFile.getAbsolutePath());
                userConfig = ConfigFactory.parseFile(userFile);
            } else {
                logger.warn("Configuration file {} cannot be read, ignoring it", userFile.getAbsolutePath());
            }
        }

        return overrides
                .withFallback(userConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    public CryptoConfig getCryptoConfig() {
        CryptoConfig cryptoConfig = CryptoConfig.fromConfig(getConfig());
        logger.debug("Loaded {}", cryptoConfig);
        return cryptoConfig;
    }
}
