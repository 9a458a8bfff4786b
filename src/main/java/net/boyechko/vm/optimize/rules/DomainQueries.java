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

import java.util.List;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;

/** Lookups shared by several rules. */
final class DomainQueries {
    static final String VIRTIO = "virtio";

    private DomainQueries() {}

    /** Disks whose device role is {@code disk}; CD-ROMs, floppies and LUNs are excluded. */
    static List<Node> hardDisks(DomainDocument doc) {
        return doc.findAll(node -> node.hasTag("disk") && "disk".equals(node.attribute("device")));
    }

    /**
     * Returns the declared vCPU count from the top-level {@code <vcpu>} element, or 1 if it is
     * absent or not a positive integer.
     */
    static int vcpuCount(DomainDocument doc) {
        Node vcpu = doc.findTopLevel("vcpu");
        if (vcpu == null || vcpu.text() == null) {
            return 1;
        }
        try {
            int count = Integer.parseInt(vcpu.text().strip());
            return count > 0 ? count : 1;
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
