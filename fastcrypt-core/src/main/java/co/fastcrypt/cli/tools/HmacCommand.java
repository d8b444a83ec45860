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

@CommandLine.Command(name = "hmac", mixinStandardHelpOptions = true, description = "Prints the HMAC-SHA256 of a message")
public class HmacCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-k", "--key"}, required = true, description = "MAC key")
    private String key;

    @CommandLine.Option(names = {"--hex"}, description = "Key and message are hex encoded")
    private boolean hex;

    @CommandLine.Parameters(index = "0", description = "Message to authenticate")
    private String message;

    @Override
    public Integer call() {
        byte[] mac = HashUtil.hmacSha256(FastCryptCli.toBytes(key, hex), FastCryptCli.toBytes(message, hex));
        spec.commandLine().getOut().println(HashUtil.toPrintableHash(mac));
        return 0;
    }
}
