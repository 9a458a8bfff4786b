/*
 * VM-Optimize - Performance Tuning for libvirt Domain Configurations
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.vm.optimize.registry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link CommandRunner} backed by {@link ProcessBuilder}. */
public class ProcessCommandRunner implements CommandRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public Result run(List<String> command, Duration timeout) throws IOException {
        logger.debug("Running {}", command);
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        // Both pipes are drained off-thread so the timeout applies even to a silent hang
        CompletableFuture<String> stdout =
                CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr =
                CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException(
                        "Command timed out after " + timeout.toSeconds() + "s: " + command);
            }
            return new Result(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + command, e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of " + command, e.getCause());
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
