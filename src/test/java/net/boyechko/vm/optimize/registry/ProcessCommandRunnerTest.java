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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {
    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void collectsExitCodeAndBothStreams() throws IOException {
        CommandRunner.Result result =
                runner.run(
                        List.of("sh", "-c", "echo out; echo err >&2; exit 3"),
                        Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertFalse(result.succeeded());
        assertEquals("out\n", result.stdout());
        assertEquals("err\n", result.stderr());
    }

    @Test
    void hungCommandTimesOut() {
        var ex =
                assertThrows(
                        IOException.class,
                        () -> runner.run(List.of("sleep", "10"), Duration.ofMillis(200)));
        assertTrue(ex.getMessage().contains("timed out"));
    }

    @Test
    void missingBinaryFailsToStart() {
        assertThrows(
                IOException.class,
                () -> runner.run(List.of("no-such-binary-vm-optimize"), Duration.ofSeconds(5)));
    }
}
