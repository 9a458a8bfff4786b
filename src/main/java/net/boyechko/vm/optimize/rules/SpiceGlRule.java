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

import java.util.Objects;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;

/** Enables OpenGL on SPICE displays, pointing at a DRM render node when none is set. */
public class SpiceGlRule implements OptimizationRule {
    public static final String DEFAULT_RENDER_NODE = "/dev/dri/renderD128";

    private final String renderNode;

    public SpiceGlRule() {
        this(DEFAULT_RENDER_NODE);
    }

    public SpiceGlRule(String renderNode) {
        this.renderNode = Objects.requireNonNull(renderNode, "renderNode");
    }

    @Override
    public RuleKey key() {
        return RuleKey.SPICE_GL;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        ChangeList changes = new ChangeList();
        for (Node graphics : doc.findAll("graphics")) {
            if (!"spice".equals(graphics.attribute("type"))) {
                continue;
            }
            Node gl = graphics.findChild("gl");
            String oldEnable = gl != null ? gl.attribute("enable", "no") : "no";
            if ("yes".equals(oldEnable)) {
                continue;
            }

            if (gl == null) {
                gl = graphics.appendChild(new Node("gl"));
            }
            gl.setAttribute("enable", "yes");
            if (!gl.hasAttribute("rendernode")) {
                gl.setAttribute("rendernode", renderNode);
            }
            changes.record(key(), "enable=" + oldEnable, "enable=yes");
        }
        return changes;
    }
}
