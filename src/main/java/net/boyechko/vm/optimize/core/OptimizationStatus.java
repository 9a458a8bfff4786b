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

/** What happened to a transformed configuration. */
public enum OptimizationStatus {
    /** No rule applied; nothing to write. */
    ALREADY_OPTIMIZED,
    /** Changes computed but not yet written anywhere. */
    PENDING,
    /** Changes computed and shown; writing was suppressed. */
    DRY_RUN,
    /** The user declined the confirmation prompt. */
    DECLINED,
    /** The registry accepted the new configuration. */
    COMMITTED,
    /** The registry rejected the new configuration; the result may be committed again. */
    COMMIT_FAILED
}
