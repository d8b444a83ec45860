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

package co.fastcrypt.cli;

import co.fastcrypt.cli.tools.BenchCommand;
import co.fastcrypt.cli.tools.DeriveCommand;
import co.fastcrypt.cli.tools.HashCommand;
import co.fastcrypt.cli.tools.HmacCommand;
import co.fastcrypt.config.ConfigLoader;
import co.fastcrypt.config.CryptoConfig;
import co.fastcrypt.crypto.CryptoException;
import co.fastcrypt.crypto.service.HashServices;
import co.fastcrypt.util.HexUtils;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;

/**
 * The entry point for the command line tool.
 */
@CommandLine.Command(name = "fastcrypt", mixinStandardHelpOptions = true, version = "fastcrypt 1.0",
        description = "SHA-256, HMAC-SHA256 and PBKDF2-HMAC-SHA256 from the command line",
        subcommands = {HashCommand.class, HmacCommand.class, DeriveCommand.class, BenchCommand.class})
public class FastCryptCli implements Runnable {

    public static final int EXIT_CRYPTO_ERROR = 1;

    private final CryptoConfig cryptoConfig;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public FastCryptCli(CryptoConfig cryptoConfig) {
        this.cryptoConfig = cryptoConfig;
    }

    public static void main(String[] args) {
        CryptoConfig cryptoConfig = ConfigLoader.fromSystemProperties().getCryptoConfig();
        HashServices.initialize(cryptoConfig);
        int exitCode = create(cryptoConfig).execute(args);
        System.exit(exitCode);
    }

    public static CommandLine create(CryptoConfig cryptoConfig) {
        CommandLine commandLine = new CommandLine(new FastCryptCli(cryptoConfig));
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof CryptoException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                return EXIT_CRYPTO_ERROR;
            }
            throw ex;
        });
        return commandLine;
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public CryptoConfig getCryptoConfig() {
        return cryptoConfig;
    }

    /**
     * Interprets a command line value as hex when {@code hex} is set, as UTF-8 text otherwise.
     */
    public static byte[] toBytes(String value, boolean hex) {
        return hex ? HexUtils.decode(value) : value.getBytes(StandardCharsets.UTF_8);
    }
}
