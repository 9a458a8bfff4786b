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

import net.boyechko.vm.optimize.report.ReportView;

/** Interface for reporting progress and results of an optimization run. */
public interface OptimizationListener {
    default void onPhaseStart(String phaseName) {}

    default void onReport(ReportView report) {}

    default void onSuccess(String message) {}

    default void onWarning(String message) {}

    default void onError(String message) {}

    default void onInfo(String message) {}
}
