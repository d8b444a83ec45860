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
import co.fastcrypt.crypto.HashUtil;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "hash", mixinStandardHelpOptions = true, description = "Prints the SHA-256 digest of the input")
public class HashCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--hex"}, description = "Input is hex encoded")
    private boolean hex;

    @CommandLine.Option(names = {"--double"}, description = "Hash the digest a second time")
    private boolean twice;

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "Input, empty by default")
    private String input = "";

    @Override
    public Integer call() {
        byte[] data = FastCryptCli.toBytes(input, hex);
        byte[] digest = twice ? HashUtil.doubleSha256(data) : HashUtil.sha256(data);
        spec.commandLine().getOut().println(HashUtil.toPrintableHash(digest));
        return 0;
    }
}
