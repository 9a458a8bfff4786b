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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import net.boyechko.vm.optimize.core.ConfirmationGate;
import net.boyechko.vm.optimize.core.DomainSelector;
import net.boyechko.vm.optimize.registry.DomainInfo;

/** Interactive domain picker and yes/no prompt on a line-oriented console. */
public class ConsolePrompter implements ConfirmationGate, DomainSelector {
    private final BufferedReader input;
    private final PrintStream output;

    public ConsolePrompter(BufferedReader input, PrintStream output) {
        this.input = input;
        this.output = output;
    }

    /** Asks until the user enters a listed number or {@code q}; end of input counts as quit. */
    @Override
    public Optional<String> select(List<DomainInfo> domains) {
        if (domains.isEmpty()) {
            output.println("No VMs found.");
            return Optional.empty();
        }

        output.println("Available VMs:");
        for (int i = 0; i < domains.size(); i++) {
            DomainInfo domain = domains.get(i);
            String state = domain.active() ? "running" : "stopped";
            output.printf("  %2d. %s (%s)%n", i + 1, domain.name(), state);
        }

        while (true) {
            output.print("Select VM [1-" + domains.size() + ", q to quit]: ");
            output.flush();
            String line = readLine();
            if (line == null) {
                output.println();
                return Optional.empty();
            }
            String answer = line.trim();
            if (answer.equalsIgnoreCase("q")) {
                return Optional.empty();
            }
            if (answer.matches("\\d{1,9}")) {
                int choice = Integer.parseInt(answer);
                if (choice >= 1 && choice <= domains.size()) {
                    return Optional.of(domains.get(choice - 1).name());
                }
            }
            output.println("Invalid selection: " + answer);
        }
    }

    /** Only {@code y} or {@code yes} (any case) confirms; anything else declines. */
    @Override
    public boolean confirm(String question) {
        output.print(question + " [y/N]: ");
        output.flush();
        String line = readLine();
        if (line == null) {
            output.println();
            return false;
        }
        String answer = line.trim().toLowerCase();
        return answer.equals("y") || answer.equals("yes");
    }

    private String readLine() {
        try {
            return input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }
}
