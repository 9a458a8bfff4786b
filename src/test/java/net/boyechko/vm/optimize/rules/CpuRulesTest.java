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
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;
import org.junit.jupiter.api.Test;

class CpuRulesTest extends DomainTestBase {
    private final CpuModeRule modeRule = new CpuModeRule();
    private final CpuTopologyRule topologyRule = new CpuTopologyRule();

    @Test
    void createsCpuDirectlyAfterVcpu() {
        DomainDocument doc =
                parse("<domain><name>x</name><vcpu>4</vcpu><os/><devices/></domain>");

        ChangeList changes = modeRule.apply(doc);

        List<String> order = doc.root().children().stream().map(Node::tag).toList();
        assertEquals(List.of("name", "vcpu", "cpu", "os", "devices"), order);
        Node cpu = doc.findTopLevel("cpu");
        assertEquals(
                List.of("mode", "check", "migratable"), List.copyOf(cpu.attributes().keySet()));
        assertEquals("default", changes.get(0).before());
        assertEquals("host-passthrough", changes.get(0).after());
    }

    @Test
    void appendsCpuWhenThereIsNoVcpu() {
        DomainDocument doc = parse("<domain><name>x</name><devices/></domain>");

        modeRule.apply(doc);

        List<Node> children = doc.root().children();
        assertEquals("cpu", children.get(children.size() - 1).tag());
    }

    @Test
    void rewritesCustomModeAndReportsOldValue() {
        DomainDocument doc =
                parse("<domain><cpu mode=\"host-model\" check=\"partial\"/></domain>");

        ChangeList changes = modeRule.apply(doc);

        Node cpu = doc.findTopLevel("cpu");
        assertEquals("host-passthrough", cpu.attribute("mode"));
        assertEquals("none", cpu.attribute("check"));
        assertEquals("on", cpu.attribute("migratable"));
        assertEquals("host-model", changes.get(0).before());
    }

    @Test
    void cpuWithoutModeRendersAsCustom() {
        DomainDocument doc = parse("<domain><cpu><model>Skylake</model></cpu></domain>");

        assertEquals("custom", modeRule.apply(doc).get(0).before());
    }

    @Test
    void passthroughCpuIsLeftAlone() {
        DomainDocument doc = parse("<domain><cpu mode=\"host-passthrough\"/></domain>");

        assertTrue(modeRule.apply(doc).isEmpty());
        assertFalse(doc.findTopLevel("cpu").hasAttribute("check"));
    }

    @Test
    void topologyUsesVcpuCountAsCores() {
        DomainDocument doc = parse("<domain><vcpu placement=\"static\">6</vcpu><cpu/></domain>");

        ChangeList changes = topologyRule.apply(doc);

        Node topology = doc.findTopLevel("cpu").findChild("topology");
        assertEquals("1", topology.attribute("sockets"));
        assertEquals("1", topology.attribute("dies"));
        assertEquals("1", topology.attribute("clusters"));
        assertEquals("6", topology.attribute("cores"));
        assertEquals("1", topology.attribute("threads"));
        assertEquals("none", changes.get(0).before());
        assertEquals("1 socket × 6 cores × 1 thread", changes.get(0).after());
    }

    @Test
    void unusableVcpuCountsFallBackToOne() {
        for (String vcpu : List.of("", "<vcpu>lots</vcpu>", "<vcpu>0</vcpu>", "<vcpu>-2</vcpu>")) {
            DomainDocument doc = parse("<domain>" + vcpu + "<cpu/></domain>");

            topologyRule.apply(doc);

            assertEquals(
                    "1",
                    doc.findTopLevel("cpu").findChild("topology").attribute("cores"),
                    "vcpu element: " + vcpu);
        }
    }

    @Test
    void existingTopologyIsLeftAlone() {
        DomainDocument doc =
                parse(
                        "<domain><vcpu>8</vcpu>"
                                + "<cpu><topology sockets=\"2\" cores=\"4\"/></cpu></domain>");

        assertTrue(topologyRule.apply(doc).isEmpty());
        assertEquals("4", doc.findAll("topology").get(0).attribute("cores"));
    }

    @Test
    void topologySkipsDomainWithoutCpu() {
        DomainDocument doc = parse("<domain><vcpu>2</vcpu></domain>");

        assertTrue(topologyRule.apply(doc).isEmpty());
        assertNull(doc.findTopLevel("cpu"));
    }
}
