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

import net.boyechko.vm.optimize.document.DocumentParseException;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.engine.TransformResult;
import net.boyechko.vm.optimize.engine.TransformationEngine;
import net.boyechko.vm.optimize.registry.CommitException;
import net.boyechko.vm.optimize.registry.DomainRegistry;
import net.boyechko.vm.optimize.registry.RegistryException;
import net.boyechko.vm.optimize.report.ChangeReporter;
import net.boyechko.vm.optimize.report.ReportView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one optimization: fetch the domain XML, transform it, report the changes, ask for
 * confirmation, and commit the new configuration to the registry.
 */
public class OptimizationService {
    private static final Logger logger = LoggerFactory.getLogger(OptimizationService.class);

    static final String CONFIRM_QUESTION = "Apply these changes?";
    static final String RESTART_WARNING =
            "VM is running. Changes take effect after the VM is shut down and started again.";

    private final TransformationEngine engine;
    private final ChangeReporter reporter;
    private final DomainRegistry registry;
    private final OptimizationListener listener;
    private final ConfirmationGate confirmationGate;
    private final boolean dryRun;

    public static class OptimizationServiceBuilder {
        private DomainRegistry registry;
        private OptimizationListener listener;
        private ConfirmationGate confirmationGate;
        private OptimizerConfig config;
        private boolean dryRun;

        public OptimizationServiceBuilder withRegistry(DomainRegistry registry) {
            this.registry = registry;
            return this;
        }

        public OptimizationServiceBuilder withListener(OptimizationListener listener) {
            this.listener = listener;
            return this;
        }

        public OptimizationServiceBuilder withConfirmationGate(ConfirmationGate gate) {
            this.confirmationGate = gate;
            return this;
        }

        public OptimizationServiceBuilder withConfig(OptimizerConfig config) {
            this.config = config;
            return this;
        }

        public OptimizationServiceBuilder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public OptimizationService build() {
            if (config == null) {
                config = OptimizerConfig.defaults();
            }
            if (listener == null) {
                listener = new OptimizationListener() {};
            }
            if (confirmationGate == null) {
                confirmationGate = ConfirmationGate.APPROVE_ALL;
            }
            return new OptimizationService(this);
        }
    }

    public static OptimizationServiceBuilder builder() {
        return new OptimizationServiceBuilder();
    }

    private OptimizationService(OptimizationServiceBuilder builder) {
        this.engine = OptimizationDefaults.engine(builder.config);
        this.reporter = OptimizationDefaults.reporter(builder.config);
        this.registry = builder.registry;
        this.listener = builder.listener;
        this.confirmationGate = builder.confirmationGate;
        this.dryRun = builder.dryRun;
    }

    /**
     * Transforms the given XML text without touching any registry.
     *
     * @return a result with status {@link OptimizationStatus#ALREADY_OPTIMIZED} or {@link
     *     OptimizationStatus#PENDING}
     * @throws DocumentParseException if the text is not well-formed
     */
    public OptimizationResult optimizeText(String xml) throws DocumentParseException {
        DomainDocument doc = DomainDocument.parse(xml);
        TransformResult transformed = engine.transform(doc);
        String optimized = transformed.canonicalText();
        ReportView report = reporter.report(transformed.changes(), xml, optimized);
        OptimizationStatus status =
                transformed.isAlreadyOptimized()
                        ? OptimizationStatus.ALREADY_OPTIMIZED
                        : OptimizationStatus.PENDING;
        return new OptimizationResult(
                null, xml, optimized, transformed.changes(), report, status, null);
    }

    /**
     * Runs the full workflow for a registry domain. Nothing is written when the domain is
     * already optimized, in dry-run mode, or when the confirmation gate declines.
     */
    public OptimizationResult optimizeDomain(String name)
            throws RegistryException, DocumentParseException {
        requireRegistry();
        listener.onPhaseStart("Analyzing " + name);
        String xml = registry.fetchXml(name);
        OptimizationResult result = optimizeText(xml).forDomain(name);
        listener.onReport(result.report());

        if (!result.hasChanges()) {
            listener.onSuccess(ReportView.ALREADY_OPTIMIZED);
            return result;
        }
        if (dryRun) {
            listener.onInfo("Dry run: no changes applied");
            return result.withStatus(OptimizationStatus.DRY_RUN);
        }
        if (!confirmationGate.confirm(CONFIRM_QUESTION)) {
            listener.onInfo("Cancelled");
            return result.withStatus(OptimizationStatus.DECLINED);
        }
        return commit(result);
    }

    /**
     * Writes the optimized XML of a result to the registry. A result whose commit failed may be
     * passed here again to retry.
     *
     * @return the result with status {@link OptimizationStatus#COMMITTED} or {@link
     *     OptimizationStatus#COMMIT_FAILED}
     */
    public OptimizationResult commit(OptimizationResult result) {
        requireRegistry();
        if (result.domainName() == null) {
            throw new IllegalArgumentException("Result has no domain name to commit to");
        }
        if (!result.hasChanges()) {
            throw new IllegalArgumentException(
                    "Nothing to commit for " + result.domainName() + ": already optimized");
        }

        String name = result.domainName();
        try {
            registry.define(name, result.optimizedXml());
        } catch (CommitException e) {
            logger.error("Commit of {} failed", name, e);
            listener.onError("Failed to apply changes: " + e.getMessage());
            return result.failed(e.getMessage());
        }

        listener.onSuccess("Configuration updated for " + name);
        if (isRunning(name)) {
            listener.onWarning(RESTART_WARNING);
        }
        return result.withStatus(OptimizationStatus.COMMITTED);
    }

    private boolean isRunning(String name) {
        try {
            return registry.isActive(name);
        } catch (RegistryException e) {
            logger.warn("Could not determine whether {} is running: {}", name, e.getMessage());
            return false;
        }
    }

    private void requireRegistry() {
        if (registry == null) {
            throw new IllegalStateException(
                    "DomainRegistry must be provided via withRegistry(...) for domain operations");
        }
    }
}
