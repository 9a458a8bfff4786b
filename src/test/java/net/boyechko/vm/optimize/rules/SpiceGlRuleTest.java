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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.vm.optimize.DomainTestBase;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;
import org.junit.jupiter.api.Test;

class SpiceGlRuleTest extends DomainTestBase {

    @Test
    void createsGlElementWithDefaultRenderNode() {
        DomainDocument doc = domainWithDevices("<graphics type=\"spice\" autoport=\"yes\"/>");

        ChangeList changes = new SpiceGlRule().apply(doc);

        Node gl = doc.findAll("gl").get(0);
        assertEquals("yes", gl.attribute("enable"));
        assertEquals(SpiceGlRule.DEFAULT_RENDER_NODE, gl.attribute("rendernode"));
        assertEquals("enable=no", changes.get(0).before());
        assertEquals("enable=yes", changes.get(0).after());
    }

    @Test
    void usesConfiguredRenderNode() {
        DomainDocument doc = domainWithDevices("<graphics type=\"spice\"/>");

        new SpiceGlRule("/dev/dri/renderD129").apply(doc);

        assertEquals("/dev/dri/renderD129", doc.findAll("gl").get(0).attribute("rendernode"));
    }

    @Test
    void keepsExistingRenderNodeWhenEnabling() {
        DomainDocument doc =
                domainWithDevices(
                        "<graphics type=\"spice\">"
                                + "<gl enable=\"no\" rendernode=\"/dev/dri/card1\"/></graphics>");

        ChangeList changes = new SpiceGlRule().apply(doc);

        Node gl = doc.findAll("gl").get(0);
        assertEquals("/dev/dri/card1", gl.attribute("rendernode"));
        assertEquals("yes", gl.attribute("enable"));
        assertEquals(1, changes.size());
    }

    @Test
    void ignoresVncAndAlreadyEnabledSpice() {
        DomainDocument doc =
                domainWithDevices(
                        "<graphics type=\"vnc\"/>"
                                + "<graphics type=\"spice\"><gl enable=\"yes\"/></graphics>");

        assertTrue(new SpiceGlRule().apply(doc).isEmpty());
        assertNull(doc.findAll("graphics").get(0).findChild("gl"));
        assertFalse(doc.findAll("gl").get(0).hasAttribute("rendernode"));
    }
}
