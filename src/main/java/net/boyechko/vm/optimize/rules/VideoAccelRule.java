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
import net.boyechko.vm.optimize.document.Node;

/**
 * Turns on {@code accel3d} for any video model that already declares an {@code <acceleration>}
 * node with 3D disabled. Models converted by {@link VideoModelRule} are already enabled.
 */
public class VideoAccelRule implements OptimizationRule {
    static final String ACCEL3D = "accel3d";

    @Override
    public RuleKey key() {
        return RuleKey.VIDEO_ACCEL;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        ChangeList changes = new ChangeList();
        for (Node video : doc.findAll("video")) {
            Node model = video.findChild("model");
            if (model == null) {
                continue;
            }
            Node accel = model.findChild("acceleration");
            if (accel == null) {
                continue;
            }
            String oldAccel = accel.attribute(ACCEL3D, "no");
            if (!"yes".equals(oldAccel)) {
                accel.setAttribute(ACCEL3D, "yes");
                changes.record(key(), ACCEL3D + "=" + oldAccel, ACCEL3D + "=yes");
            }
        }
        return changes;
    }
}
