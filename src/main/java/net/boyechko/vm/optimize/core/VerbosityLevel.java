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

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only errors and final status
 *   <li>NORMAL - Change log and diff (default)
 *   <li>VERBOSE - Processing steps and info logs
 *   <li>DEBUG - All information including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0, "error"),
    NORMAL(1, "warn"),
    VERBOSE(2, "info"),
    DEBUG(3, "debug");

    private final int level;
    private final String logLevel;

    VerbosityLevel(int level, String logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    /** The Logback level name used for the root logger at this verbosity. */
    public String logLevel() {
        return logLevel;
    }

    /**
     * Check if output should be shown for the specified level.
     *
     * @param requiredLevel the minimum level required to show the output
     * @return true if output should be shown
     */
    public boolean shouldShow(VerbosityLevel requiredLevel) {
        return this.level >= requiredLevel.level;
    }
}
