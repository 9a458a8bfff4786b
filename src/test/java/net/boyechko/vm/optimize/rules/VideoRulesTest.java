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

import java.util.List;
import net.boyechko.vm.optimize.DomainTestBase;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.ChangeRecord;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;
import org.junit.jupiter.api.Test;

class VideoRulesTest extends DomainTestBase {
    private final VideoModelRule modelRule = new VideoModelRule();
    private final VideoAccelRule accelRule = new VideoAccelRule();

    @Test
    void qxlBecomesAcceleratedVirtioGpu() {
        DomainDocument doc =
                domainWithDevices(
                        "<video><model type=\"qxl\" ram=\"65536\" vram=\"65536\" heads=\"1\"/>"
                                + "</video>");

        ChangeList changes = modelRule.apply(doc);

        Node model = doc.findAll("model").get(0);
        assertEquals("virtio", model.attribute("type"));
        assertEquals("1", model.attribute("heads"));
        assertEquals("yes", model.attribute("primary"));
        assertEquals("yes", model.findChild("acceleration").attribute("accel3d"));
        assertEquals(
                List.of(
                        new ChangeRecord(RuleKey.VIDEO_MODEL, "qxl", "virtio"),
                        new ChangeRecord(RuleKey.VIDEO_ACCEL, "accel3d=no", "accel3d=yes")),
                changes);
    }

    @Test
    void existingEnabledAccelerationIsNotReportedTwice() {
        DomainDocument doc =
                domainWithDevices(
                        "<video><model type=\"vga\">"
                                + "<acceleration accel3d=\"yes\"/></model></video>");

        ChangeList changes = modelRule.apply(doc);

        assertEquals(List.of(RuleKey.VIDEO_MODEL), changes.rules());
        assertEquals(1, doc.findAll("acceleration").size());
    }

    @Test
    void accelRuleHasNothingLeftAfterModelRule() {
        DomainDocument doc = domainWithDevices("<video><model type=\"cirrus\"/></video>");

        modelRule.apply(doc);

        assertTrue(accelRule.apply(doc).isEmpty());
    }

    @Test
    void accelRuleEnablesDisabledVirtioAcceleration() {
        DomainDocument doc = parseFixture("no-cpu-sata.xml");

        ChangeList changes = accelRule.apply(doc);

        assertEquals(
                List.of(new ChangeRecord(RuleKey.VIDEO_ACCEL, "accel3d=no", "accel3d=yes")),
                changes);
        assertEquals("yes", doc.findAll("acceleration").get(0).attribute("accel3d"));
    }

    @Test
    void accelRuleEnablesDisabledAccelerationOnAnyModelType() {
        DomainDocument doc =
                domainWithDevices(
                        "<video><model type=\"bochs\">"
                                + "<acceleration accel3d=\"no\"/></model></video>");

        ChangeList changes = accelRule.apply(doc);

        assertEquals(
                List.of(new ChangeRecord(RuleKey.VIDEO_ACCEL, "accel3d=no", "accel3d=yes")),
                changes);
        assertEquals("bochs", doc.findAll("model").get(0).attribute("type"));
        assertEquals("yes", doc.findAll("acceleration").get(0).attribute("accel3d"));
        assertTrue(accelRule.apply(doc).isEmpty());
    }

    @Test
    void accelRuleIgnoresVirtioWithoutAccelerationNode() {
        DomainDocument doc = domainWithDevices("<video><model type=\"virtio\"/></video>");

        assertTrue(accelRule.apply(doc).isEmpty());
        assertTrue(doc.findAll("acceleration").isEmpty());
    }

    @Test
    void modernAdaptersAreLeftAlone() {
        DomainDocument doc =
                domainWithDevices(
                        "<video><model type=\"bochs\"/></video>"
                                + "<video><model type=\"none\"/></video>");

        assertTrue(modelRule.apply(doc).isEmpty());
        assertTrue(accelRule.apply(doc).isEmpty());
    }
}
