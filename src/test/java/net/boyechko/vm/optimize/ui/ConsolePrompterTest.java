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
package net.boyechko.vm.optimize.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import net.boyechko.vm.optimize.registry.DomainInfo;
import org.junit.jupiter.api.Test;

class ConsolePrompterTest {
    private static final List<DomainInfo> DOMAINS =
            List.of(new DomainInfo("debian12", false), new DomainInfo("fedora40", true));

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ConsolePrompter prompter(String input) {
        return new ConsolePrompter(
                new BufferedReader(new StringReader(input)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void selectsByNumberAndShowsState() {
        Optional<String> chosen = prompter("2\n").select(DOMAINS);

        assertEquals(Optional.of("fedora40"), chosen);
        String shown = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(shown.contains(" 1. debian12 (stopped)"));
        assertTrue(shown.contains(" 2. fedora40 (running)"));
    }

    @Test
    void retriesAfterInvalidInput() {
        Optional<String> chosen = prompter("banana\n0\n3\n1\n").select(DOMAINS);

        assertEquals(Optional.of("debian12"), chosen);
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Invalid selection: banana"));
    }

    @Test
    void quitAndEndOfInputSelectNothing() {
        assertEquals(Optional.empty(), prompter("q\n").select(DOMAINS));
        assertEquals(Optional.empty(), prompter("").select(DOMAINS));
    }

    @Test
    void emptyListSelectsNothing() {
        assertEquals(Optional.empty(), prompter("1\n").select(List.of()));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("No VMs found."));
    }

    @Test
    void onlyYesConfirms() {
        assertTrue(prompter("y\n").confirm("Apply these changes?"));
        assertTrue(prompter(" YES \n").confirm("Apply these changes?"));
        assertFalse(prompter("\n").confirm("Apply these changes?"));
        assertFalse(prompter("n\n").confirm("Apply these changes?"));
        assertFalse(prompter("").confirm("Apply these changes?"));
        String shown = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(shown.contains("Apply these changes? [y/N]: "));
    }
}
