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
package net.boyechko.vm.optimize.rules;

import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DomainDocument;

/**
 * A single named check-and-mutate step over a domain document.
 *
 * <p>Rules must be idempotent: once a rule has applied its mutation, running it again on the
 * result returns an empty list. A node the rule cannot evaluate (for example a missing child it
 * needs) is skipped; a rule never fails the whole pass because of one node.
 */
public interface OptimizationRule {

    /** The key recorded on changes this rule produces. */
    RuleKey key();

    /**
     * Applies the rule to the document in place.
     *
     * @return the changes made, in document order; empty if nothing applied
     */
    ChangeList apply(DomainDocument doc);

    default String name() {
        return getClass().getSimpleName();
    }
}
