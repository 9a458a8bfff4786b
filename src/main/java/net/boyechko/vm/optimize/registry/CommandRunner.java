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
import java.time.Duration;
import java.util.List;

/** Runs an external command and collects its output. */
public interface CommandRunner {

    /**
     * @param exitCode process exit status
     * @param stdout everything written to standard output
     * @param stderr everything written to standard error
     */
    record Result(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /**
     * Runs the command and waits for it to finish.
     *
     * @throws IOException if the command cannot be started or does not finish within the timeout
     */
    Result run(List<String> command, Duration timeout) throws IOException;
}
