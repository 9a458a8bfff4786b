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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Registry that drives the {@code virsh} command line against a libvirt connection URI. */
public class VirshDomainRegistry implements DomainRegistry {
    private static final Logger logger = LoggerFactory.getLogger(VirshDomainRegistry.class);

    private final String binary;
    private final String uri;
    private final Duration timeout;
    private final CommandRunner runner;

    public VirshDomainRegistry(String binary, String uri, Duration timeout, CommandRunner runner) {
        this.binary = binary;
        this.uri = uri;
        this.timeout = timeout;
        this.runner = runner;
    }

    @Override
    public List<DomainInfo> listDomains() throws RegistryException {
        List<String> all = names(virsh("list", "--all", "--name"));
        Set<String> running = Set.copyOf(names(virsh("list", "--name")));

        List<DomainInfo> domains = new ArrayList<>();
        for (String name : all) {
            domains.add(new DomainInfo(name, running.contains(name)));
        }
        domains.sort(DomainInfo.BY_NAME);
        return domains;
    }

    @Override
    public String fetchXml(String name) throws RegistryException {
        return virsh("dumpxml", name);
    }

    @Override
    public void define(String name, String xml) throws CommitException {
        Path staged = null;
        try {
            staged = Files.createTempFile("vm-optimize-", ".xml");
            Files.writeString(staged, xml, StandardCharsets.UTF_8);

            CommandRunner.Result result = runner.run(command("define", staged.toString()), timeout);
            if (!result.succeeded()) {
                throw new CommitException(
                        name, "virsh define failed for '" + name + "': " + errorText(result));
            }
            logger.info("Defined '{}' on {}", name, uri);
        } catch (IOException e) {
            throw new CommitException(
                    name, "Could not define '" + name + "': " + e.getMessage(), e);
        } finally {
            deleteStaged(staged);
        }
    }

    @Override
    public String describe() {
        return uri;
    }

    private String virsh(String... args) throws RegistryException {
        List<String> command = command(args);
        CommandRunner.Result result;
        try {
            result = runner.run(command, timeout);
        } catch (IOException e) {
            throw new RegistryException("Could not run " + binary + ": " + e.getMessage(), e);
        }
        if (!result.succeeded()) {
            throw new RegistryException(
                    binary + " " + String.join(" ", args) + " failed: " + errorText(result));
        }
        return result.stdout();
    }

    private List<String> command(String... args) {
        List<String> command = new ArrayList<>(List.of(binary, "-c", uri));
        command.addAll(List.of(args));
        return command;
    }

    private static List<String> names(String output) {
        return output.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    private static String errorText(CommandRunner.Result result) {
        String stderr = result.stderr().strip();
        return stderr.isEmpty() ? "exit status " + result.exitCode() : stderr;
    }

    private static void deleteStaged(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            logger.warn("Failed to delete staged XML {}: {}", staged, e.getMessage());
        }
    }
}
