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
package net.boyechko.vm.optimize.report;

import net.boyechko.vm.optimize.change.ChangeRecord;
import net.boyechko.vm.optimize.change.RuleKey;

/** A change record paired with the fixed explanation of its rule. */
public record ChangeDescription(RuleKey rule, String before, String after) {

    public static ChangeDescription of(ChangeRecord change) {
        return new ChangeDescription(change.rule(), change.before(), change.after());
    }

    public String description() {
        return rule.description();
    }

    public String detail() {
        return rule.detail();
    }
}
