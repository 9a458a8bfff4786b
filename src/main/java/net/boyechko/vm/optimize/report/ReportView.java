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
package net.boyechko.vm.optimize.report;

import java.util.List;

/**
 * Formatted change log and abbreviated unified diff, ready to display.
 *
 * @param changes one entry per change record, in application order
 * @param diffLines the displayed diff lines, headers included
 * @param hiddenDiffLines number of diff lines cut off after {@code diffLines}
 */
public record ReportView(
        List<ChangeDescription> changes, List<String> diffLines, int hiddenDiffLines) {
    public static final String ALREADY_OPTIMIZED = "VM is already optimized. No changes needed.";

    public ReportView {
        changes = List.copyOf(changes);
        diffLines = List.copyOf(diffLines);
        if (hiddenDiffLines < 0) {
            throw new IllegalArgumentException("hiddenDiffLines must not be negative");
        }
    }

    public static ReportView alreadyOptimized() {
        return new ReportView(List.of(), List.of(), 0);
    }

    public boolean isAlreadyOptimized() {
        return changes.isEmpty();
    }

    public boolean isTruncated() {
        return hiddenDiffLines > 0;
    }

    /** The marker shown after a truncated diff, e.g. {@code ... (12 more lines)}. */
    public String truncationMarker() {
        return "... (" + hiddenDiffLines + " more lines)";
    }

    /** Renders the report without colour or box drawing. */
    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        if (isAlreadyOptimized()) {
            return sb.append("✓ ").append(ALREADY_OPTIMIZED).append('\n').toString();
        }

        sb.append("PROPOSED OPTIMIZATIONS\n");
        for (ChangeDescription change : changes) {
            sb.append('\n');
            sb.append("● ").append(change.description()).append('\n');
            sb.append("  Before: ").append(change.before()).append('\n');
            sb.append("  After:  ").append(change.after()).append('\n');
            if (!change.detail().isEmpty()) {
                sb.append("  → ").append(change.detail()).append('\n');
            }
        }

        sb.append("\nXML DIFF (abbreviated)\n");
        for (String line : diffLines) {
            sb.append(line).append('\n');
        }
        if (isTruncated()) {
            sb.append('\n').append(truncationMarker()).append('\n');
        }
        return sb.toString();
    }
}
