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
package net.boyechko.vm.optimize.change;

import java.util.Objects;

/**
 * One applied optimization: which rule fired and the human-readable value before and after.
 *
 * @param rule the rule that produced this change
 * @param before the previous value, rendered with defaults for absent attributes
 * @param after the new value
 */
public record ChangeRecord(RuleKey rule, String before, String after) {
    public ChangeRecord {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    @Override
    public String toString() {
        return rule.key() + ": " + before + " -> " + after;
    }
}
