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

import java.util.HashSet;
import java.util.Set;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves emulated IDE, SATA and SCSI disks onto the VirtIO bus and renames the target device
 * ({@code hda}/{@code sda} → {@code vda}).
 */
public class DiskBusRule implements OptimizationRule {
    private static final Logger logger = LoggerFactory.getLogger(DiskBusRule.class);

    private static final Set<String> EMULATED_BUSES = Set.of("ide", "sata", "scsi");

    @Override
    public RuleKey key() {
        return RuleKey.DISK_BUS;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        ChangeList changes = new ChangeList();
        Set<String> usedDevs = new HashSet<>();
        for (Node disk : doc.findAll("disk")) {
            Node target = disk.findChild("target");
            if (target != null && target.hasAttribute("dev")) {
                usedDevs.add(target.attribute("dev"));
            }
        }

        for (Node disk : DomainQueries.hardDisks(doc)) {
            Node target = disk.findChild("target");
            if (target == null) {
                logger.debug("Skipping {}: no <target>", disk);
                continue;
            }
            // A missing bus renders as "unknown" and is left alone
            String oldBus = target.attribute("bus", "unknown");
            if (!EMULATED_BUSES.contains(oldBus)) {
                continue;
            }

            target.setAttribute("bus", DomainQueries.VIRTIO);
            String oldDev = target.attribute("dev", "");
            if (oldDev.isEmpty()) {
                changes.record(key(), oldBus, DomainQueries.VIRTIO);
                continue;
            }

            String newDev = renameDevice(oldDev);
            if (!newDev.equals(oldDev)) {
                if (usedDevs.contains(newDev)) {
                    logger.warn(
                            "Renaming disk target {} to {} collides with an existing target",
                            oldDev,
                            newDev);
                }
                usedDevs.add(newDev);
                target.setAttribute("dev", newDev);
            }
            changes.record(
                    key(),
                    oldBus + " (" + oldDev + ")",
                    DomainQueries.VIRTIO + " (" + newDev + ")");
        }
        return changes;
    }

    /** Replaces a leading {@code hd} or {@code sd} with {@code vd}; other names are unchanged. */
    static String renameDevice(String dev) {
        if (dev.startsWith("hd") || dev.startsWith("sd")) {
            return "vd" + dev.substring(2);
        }
        return dev;
    }
}
