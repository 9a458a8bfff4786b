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

/**
 * Switches QXL, VGA and Cirrus video to a single-head primary VirtIO GPU with 3D acceleration.
 *
 * <p>Enabling acceleration is part of this change. When the model did not already have {@code
 * accel3d="yes"}, a {@link RuleKey#VIDEO_ACCEL} record is emitted right after the video record,
 * so {@link VideoAccelRule} has nothing left to do for this model.
 */
public class VideoModelRule implements OptimizationRule {
    private static final Set<String> LEGACY_ADAPTERS = Set.of("qxl", "vga", "cirrus");

    @Override
    public RuleKey key() {
        return RuleKey.VIDEO_MODEL;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        ChangeList changes = new ChangeList();
        for (Node video : doc.findAll("video")) {
            Node model = video.findChild("model");
            if (model == null) {
                continue;
            }
            String oldType = model.attribute("type", "unknown");
            if (!LEGACY_ADAPTERS.contains(oldType)) {
                continue;
            }

            model.setAttribute("type", DomainQueries.VIRTIO);
            model.setAttribute("heads", "1");
            model.setAttribute("primary", "yes");

            Node accel = model.findChild("acceleration");
            if (accel == null) {
                accel = model.appendChild(new Node("acceleration"));
            }
            String oldAccel = accel.attribute(VideoAccelRule.ACCEL3D, "no");
            accel.setAttribute(VideoAccelRule.ACCEL3D, "yes");

            changes.record(key(), oldType, DomainQueries.VIRTIO);
            if (!"yes".equals(oldAccel)) {
                changes.record(
                        RuleKey.VIDEO_ACCEL,
                        VideoAccelRule.ACCEL3D + "=" + oldAccel,
                        VideoAccelRule.ACCEL3D + "=yes");
            }
        }
        return changes;
    }
}
