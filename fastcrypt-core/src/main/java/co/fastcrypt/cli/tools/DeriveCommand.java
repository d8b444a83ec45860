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

package co.fastcrypt.cli.tools;

import co.fastcrypt.cli.FastCryptCli;
import co.fastcrypt.config.CryptoConfig;
import co.fastcrypt.crypto.HashUtil;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "derive", mixinStandardHelpOptions = true,
        description = "Derives a key with PBKDF2-HMAC-SHA256")
public class DeriveCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private FastCryptCli parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-p", "--password"}, required = true, description = "Password")
    private String password;

    @CommandLine.Option(names = {"-s", "--salt"}, required = true, description = "Salt")
    private String salt;

    @CommandLine.Option(names = {"-i", "--iterations"}, description = "Iteration count, crypto.kdf.iterations by default")
    private Integer iterations;

    @CommandLine.Option(names = {"-l", "--length"}, description = "Output length in bytes, crypto.kdf.length by default")
    private Integer length;

    @CommandLine.Option(names = {"--hex"}, description = "Password and salt are hex encoded")
    private boolean hex;

    @Override
    public Integer call() {
        CryptoConfig config = parent.getCryptoConfig();
        int rounds = iterations != null ? iterations : config.kdfIterations();
        int outputLength = length != null ? length : config.kdfLength();

        byte[] key = HashUtil.pbkdf2(
                FastCryptCli.toBytes(password, hex), FastCryptCli.toBytes(salt, hex), rounds, outputLength);
        spec.commandLine().getOut().println(HashUtil.toPrintableHash(key));
        return 0;
    }
}
