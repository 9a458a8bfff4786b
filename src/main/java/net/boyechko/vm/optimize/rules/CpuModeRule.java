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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets the guest CPU to {@code host-passthrough} with {@code check="none"} and {@code
 * migratable="on"}. A domain without a {@code <cpu>} element gets one, placed directly after
 * {@code <vcpu>} (or at the end of the domain if there is no {@code <vcpu>}).
 */
public class CpuModeRule implements OptimizationRule {
    private static final Logger logger = LoggerFactory.getLogger(CpuModeRule.class);

    static final String HOST_PASSTHROUGH = "host-passthrough";

    @Override
    public RuleKey key() {
        return RuleKey.CPU_MODE;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        Node cpu = doc.findTopLevel("cpu");
        if (cpu == null) {
            cpu = new Node("cpu");
            applyPassthrough(cpu);

            Node vcpu = doc.findTopLevel("vcpu");
            if (vcpu != null) {
                doc.root().insertChildAfter(vcpu, cpu);
            } else {
                doc.root().appendChild(cpu);
            }
            logger.debug("Created <cpu> element");
            return new ChangeList().record(key(), "default", HOST_PASSTHROUGH);
        }

        String oldMode = cpu.attribute("mode", "custom");
        if (HOST_PASSTHROUGH.equals(oldMode)) {
            return new ChangeList();
        }
        applyPassthrough(cpu);
        return new ChangeList().record(key(), oldMode, HOST_PASSTHROUGH);
    }

    private static void applyPassthrough(Node cpu) {
        cpu.setAttribute("mode", HOST_PASSTHROUGH);
        cpu.setAttribute("check", "none");
        cpu.setAttribute("migratable", "on");
    }
}
