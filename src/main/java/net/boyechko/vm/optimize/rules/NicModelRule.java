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

import java.util.Set;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;

/** Replaces emulated network cards (rtl8139, e1000, e1000e) with VirtIO. */
public class NicModelRule implements OptimizationRule {
    private static final Set<String> EMULATED_NICS = Set.of("rtl8139", "e1000", "e1000e");

    @Override
    public RuleKey key() {
        return RuleKey.NIC_MODEL;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        ChangeList changes = new ChangeList();
        for (Node iface : doc.findAll("interface")) {
            Node model = iface.findChild("model");
            if (model == null) {
                continue;
            }
            String oldType = model.attribute("type", "unknown");
            if (EMULATED_NICS.contains(oldType)) {
                model.setAttribute("type", DomainQueries.VIRTIO);
                changes.record(key(), oldType, DomainQueries.VIRTIO);
            }
        }
        return changes;
    }
}
