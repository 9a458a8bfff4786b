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

import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.report.ReportView;

/**
 * Outcome of optimizing one domain configuration.
 *
 * @param domainName registry name of the domain, or null when optimizing bare text
 * @param originalXml the input text as received
 * @param optimizedXml canonical text of the transformed document
 * @param changes changes applied by the rules
 * @param report formatted change log and diff
 * @param status what happened to the result
 * @param errorMessage commit failure message, or null
 */
public record OptimizationResult(
        String domainName,
        String originalXml,
        String optimizedXml,
        ChangeList changes,
        ReportView report,
        OptimizationStatus status,
        String errorMessage) {

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    OptimizationResult forDomain(String name) {
        return new OptimizationResult(
                name, originalXml, optimizedXml, changes, report, status, errorMessage);
    }

    OptimizationResult withStatus(OptimizationStatus newStatus) {
        return new OptimizationResult(
                domainName, originalXml, optimizedXml, changes, report, newStatus, null);
    }

    OptimizationResult failed(String message) {
        return new OptimizationResult(
                domainName,
                originalXml,
                optimizedXml,
                changes,
                report,
                OptimizationStatus.COMMIT_FAILED,
                message);
    }
}
