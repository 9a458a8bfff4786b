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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Ordered change records, in the order the rules applied them. */
public class ChangeList extends ArrayList<ChangeRecord> {

    public ChangeList() {
        super();
    }

    /** Convenience for rules: appends a new record and returns this list. */
    public ChangeList record(RuleKey rule, String before, String after) {
        add(new ChangeRecord(rule, before, after));
        return this;
    }

    /** Returns the subset of changes produced by the given rule. */
    public ChangeList forRule(RuleKey rule) {
        return stream()
                .filter(change -> change.rule() == rule)
                .collect(Collectors.toCollection(ChangeList::new));
    }

    /** Returns the rule of each change, in order, duplicates kept. */
    public List<RuleKey> rules() {
        return stream().map(ChangeRecord::rule).toList();
    }
}
