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
package net.boyechko.vm.optimize.core;

import java.time.Duration;
import java.util.List;
import net.boyechko.vm.optimize.engine.TransformationEngine;
import net.boyechko.vm.optimize.registry.ProcessCommandRunner;
import net.boyechko.vm.optimize.registry.VirshDomainRegistry;
import net.boyechko.vm.optimize.report.ChangeReporter;
import net.boyechko.vm.optimize.rules.CpuModeRule;
import net.boyechko.vm.optimize.rules.CpuTopologyRule;
import net.boyechko.vm.optimize.rules.DiskBusRule;
import net.boyechko.vm.optimize.rules.DiskCacheRule;
import net.boyechko.vm.optimize.rules.NicModelRule;
import net.boyechko.vm.optimize.rules.OptimizationRule;
import net.boyechko.vm.optimize.rules.SpiceGlRule;
import net.boyechko.vm.optimize.rules.VideoAccelRule;
import net.boyechko.vm.optimize.rules.VideoModelRule;

/** The fixed rule set and the components built from configuration. */
public final class OptimizationDefaults {
    private OptimizationDefaults() {}

    /**
     * Returns the rules in the order they must run. Later rules observe earlier rules' mutations:
     * video_accel relies on video_model having run, and cpu_topology on cpu_mode having created
     * the {@code <cpu>} element.
     */
    public static List<OptimizationRule> rules(OptimizerConfig config) {
        return List.of(
                new DiskBusRule(),
                new DiskCacheRule(),
                new NicModelRule(),
                new VideoModelRule(),
                new VideoAccelRule(),
                new SpiceGlRule(config.spice.rendernode),
                new CpuModeRule(),
                new CpuTopologyRule());
    }

    public static List<OptimizationRule> rules() {
        return rules(OptimizerConfig.defaults());
    }

    public static TransformationEngine engine(OptimizerConfig config) {
        return new TransformationEngine(rules(config));
    }

    public static ChangeReporter reporter(OptimizerConfig config) {
        return new ChangeReporter(config.report.max_diff_lines, config.report.diff_context_lines);
    }

    public static VirshDomainRegistry virshRegistry(OptimizerConfig config, String uri) {
        return new VirshDomainRegistry(
                config.virsh.binary,
                uri != null ? uri : config.virsh.default_uri,
                Duration.ofSeconds(config.virsh.timeout_seconds),
                new ProcessCommandRunner());
    }
}
