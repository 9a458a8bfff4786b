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

import java.util.Comparator;

/**
 * A domain known to a registry.
 *
 * @param name the domain name
 * @param active whether the domain is currently running
 */
public record DomainInfo(String name, boolean active) {
    /** Orders domains by name, ignoring case. */
    public static final Comparator<DomainInfo> BY_NAME =
            Comparator.comparing(DomainInfo::name, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(DomainInfo::name);
}
