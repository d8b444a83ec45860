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
import co.fastcrypt.crypto.service.HashServices;
import co.fastcrypt.util.HashBenchmark;
import picocli.CommandLine;

import java.util.Locale;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "bench", mixinStandardHelpOptions = true,
        description = "Measures SHA-256 throughput of the configured library")
public class BenchCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private FastCryptCli parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--size"}, description = "Buffer size in bytes, crypto.benchmark.size by default")
    private Integer size;

    @CommandLine.Option(names = {"-i", "--iterations"}, description = "Number of digests, crypto.benchmark.iterations by default")
    private Integer iterations;

    @Override
    public Integer call() {
        CryptoConfig config = parent.getCryptoConfig();
        HashBenchmark.Result result = new HashBenchmark(HashServices.getInstance()).run(
                size != null ? size : config.benchmarkSize(),
                iterations != null ? iterations : config.benchmarkIterations());

        spec.commandLine().getOut().println(String.format(Locale.ROOT, "%s: %d x %d bytes in %.6f s (%.2f MB/s)",
                result.getLibrary(), result.getIterations(), result.getDataSize(),
                result.getSeconds(), result.getMegabytesPerSecond()));
        return 0;
    }
}
