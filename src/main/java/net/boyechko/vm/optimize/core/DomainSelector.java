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
package net.boyechko.vm.optimize.core;

import java.util.List;
import java.util.Optional;
import net.boyechko.vm.optimize.registry.DomainInfo;

/** Chooses which domain to optimize. */
@FunctionalInterface
public interface DomainSelector {
    /**
     * @param domains the available domains, in display order
     * @return the chosen domain name, or empty if the user quit
     */
    Optional<String> select(List<DomainInfo> domains);
}
