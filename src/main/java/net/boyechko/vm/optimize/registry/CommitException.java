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

/**
 * Thrown when the registry fails to persist a transformed document. The transformation output is
 * still valid and the commit can be retried.
 */
public class CommitException extends Exception {
    private final String domainName;

    public CommitException(String domainName, String message) {
        super(message);
        this.domainName = domainName;
    }

    public CommitException(String domainName, String message, Throwable cause) {
        super(message, cause);
        this.domainName = domainName;
    }

    public String domainName() {
        return domainName;
    }
}
