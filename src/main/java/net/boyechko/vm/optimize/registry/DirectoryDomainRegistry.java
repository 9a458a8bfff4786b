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
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry backed by a directory of {@code <name>.xml} files, such as a saved set of {@code virsh
 * dumpxml} outputs. Domains are never reported as running.
 */
public class DirectoryDomainRegistry implements DomainRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryDomainRegistry.class);

    private static final String SUFFIX = ".xml";

    private final Path directory;

    public DirectoryDomainRegistry(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<DomainInfo> listDomains() throws RegistryException {
        List<DomainInfo> domains = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(fileName -> fileName.endsWith(SUFFIX))
                    .map(fileName -> fileName.substring(0, fileName.length() - SUFFIX.length()))
                    .forEach(name -> domains.add(new DomainInfo(name, false)));
        } catch (IOException e) {
            throw new RegistryException("Cannot list " + directory + ": " + e.getMessage(), e);
        }
        domains.sort(DomainInfo.BY_NAME);
        return domains;
    }

    @Override
    public String fetchXml(String name) throws RegistryException {
        Path file = fileFor(name);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new RegistryException("Domain not found: " + name, e);
        } catch (IOException e) {
            throw new RegistryException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /** Writes the XML to a sibling temp file, then moves it over the domain file. */
    @Override
    public void define(String name, String xml) throws CommitException {
        Path target = fileFor(name);
        Path staged = null;
        try {
            staged = Files.createTempFile(directory, "." + name + "-", ".tmp");
            Files.writeString(staged, xml, StandardCharsets.UTF_8);
            try {
                Files.move(
                        staged,
                        target,
                        StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
            }
            staged = null;
            logger.info("Wrote {}", target);
        } catch (IOException e) {
            throw new CommitException(name, "Cannot write " + target + ": " + e.getMessage(), e);
        } finally {
            if (staged != null) {
                try {
                    Files.deleteIfExists(staged);
                } catch (IOException e) {
                    logger.warn("Failed to delete {}: {}", staged, e.getMessage());
                }
            }
        }
    }

    @Override
    public boolean isActive(String name) {
        return false;
    }

    @Override
    public String describe() {
        return directory.toString();
    }

    private Path fileFor(String name) {
        if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("Invalid domain name: " + name);
        }
        return directory.resolve(name + SUFFIX);
    }
}
