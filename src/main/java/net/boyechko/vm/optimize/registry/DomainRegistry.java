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

import java.util.List;

/**
 * Source and sink of domain XML.
 *
 * <p>{@link #define} replaces the persistent configuration only; a running domain keeps its
 * current configuration until it is restarted.
 */
public interface DomainRegistry {

    /** Lists all domains, sorted by name ignoring case. */
    List<DomainInfo> listDomains() throws RegistryException;

    /** Returns the XML descriptor of the named domain. */
    String fetchXml(String name) throws RegistryException;

    /** Replaces the persistent configuration of the named domain. */
    void define(String name, String xml) throws CommitException;

    /** Returns whether the named domain is running; false if it is unknown. */
    default boolean isActive(String name) throws RegistryException {
        return listDomains().stream().anyMatch(d -> d.name().equals(name) && d.active());
    }

    /** Short human-readable description, e.g. the connection URI or directory. */
    String describe();
}
