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
package net.boyechko.vm.optimize.engine;

import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.document.Canonicalizer;
import net.boyechko.vm.optimize.document.DomainDocument;

/**
 * Outcome of one transformation pass.
 *
 * @param document the transformed document (the same instance that was passed in)
 * @param changes every change applied, in rule order then document order
 */
public record TransformResult(DomainDocument document, ChangeList changes) {

    /** True if no rule applied, i.e. the input was already optimized. */
    public boolean isAlreadyOptimized() {
        return changes.isEmpty();
    }

    /** Canonical text of the transformed document. */
    public String canonicalText() {
        return Canonicalizer.canonicalize(document);
    }
}
