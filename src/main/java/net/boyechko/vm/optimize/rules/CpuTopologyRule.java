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
 * Adds a one-socket topology to a {@code <cpu>} element that has none, with one core per
 * declared vCPU and one thread per core.
 */
public class CpuTopologyRule implements OptimizationRule {
    private static final Logger logger = LoggerFactory.getLogger(CpuTopologyRule.class);

    @Override
    public RuleKey key() {
        return RuleKey.CPU_TOPOLOGY;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        Node cpu = doc.findTopLevel("cpu");
        if (cpu == null) {
            logger.debug("Skipping topology: domain has no <cpu>");
            return new ChangeList();
        }
        if (cpu.findChild("topology") != null) {
            return new ChangeList();
        }

        int cores = DomainQueries.vcpuCount(doc);
        cpu.appendChild(new Node("topology"))
                .setAttribute("sockets", "1")
                .setAttribute("dies", "1")
                .setAttribute("clusters", "1")
                .setAttribute("cores", String.valueOf(cores))
                .setAttribute("threads", "1");
        return new ChangeList().record(key(), "none", "1 socket × " + cores + " cores × 1 thread");
    }
}
