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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class VerbosityLevelTest {

    @ParameterizedTest
    @CsvSource({"QUIET, error", "NORMAL, warn", "VERBOSE, info", "DEBUG, debug"})
    void mapsToLogbackLevel(VerbosityLevel level, String expected) {
        assertEquals(expected, level.logLevel());
    }

    @ParameterizedTest
    @CsvSource({
        "QUIET, QUIET, true",
        "QUIET, NORMAL, false",
        "NORMAL, NORMAL, true",
        "VERBOSE, NORMAL, true",
        "NORMAL, VERBOSE, false",
        "DEBUG, VERBOSE, true"
    })
    void showsOutputAtOrBelowCurrentLevel(
            VerbosityLevel current, VerbosityLevel required, boolean shown) {
        assertEquals(shown, current.shouldShow(required));
    }
}
