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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.List;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.document.Canonicalizer;
import net.boyechko.vm.optimize.document.DocumentParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns change records and the two document texts into a {@link ReportView}. Both texts are
 * canonicalized before diffing, so formatting differences in the input never show up as changes.
 */
public class ChangeReporter {
    private static final Logger logger = LoggerFactory.getLogger(ChangeReporter.class);

    public static final int DEFAULT_MAX_DIFF_LINES = 50;
    public static final int DEFAULT_CONTEXT_LINES = 3;

    static final String ORIGINAL_LABEL = "original";
    static final String OPTIMIZED_LABEL = "optimized";

    private final int maxDiffLines;
    private final int contextLines;

    public ChangeReporter() {
        this(DEFAULT_MAX_DIFF_LINES, DEFAULT_CONTEXT_LINES);
    }

    public ChangeReporter(int maxDiffLines, int contextLines) {
        if (maxDiffLines < 0 || contextLines < 0) {
            throw new IllegalArgumentException(
                    "Diff limits must not be negative: maxDiffLines="
                            + maxDiffLines
                            + ", contextLines="
                            + contextLines);
        }
        this.maxDiffLines = maxDiffLines;
        this.contextLines = contextLines;
    }

    public ReportView report(ChangeList changes, String originalText, String optimizedText) {
        if (changes.isEmpty()) {
            return ReportView.alreadyOptimized();
        }

        List<String> diff = unifiedDiff(originalText, optimizedText);
        int shown = Math.min(diff.size(), maxDiffLines);
        return new ReportView(
                changes.stream().map(ChangeDescription::of).toList(),
                diff.subList(0, shown),
                diff.size() - shown);
    }

    /** Full unified diff between the canonical forms of the two texts. */
    public List<String> unifiedDiff(String originalText, String optimizedText) {
        List<String> original = canonicalLines(originalText);
        List<String> optimized = canonicalLines(optimizedText);
        Patch<String> patch = DiffUtils.diff(original, optimized);
        if (patch.getDeltas().isEmpty()) {
            return List.of();
        }
        return UnifiedDiffUtils.generateUnifiedDiff(
                ORIGINAL_LABEL, OPTIMIZED_LABEL, original, patch, contextLines);
    }

    private static List<String> canonicalLines(String text) {
        try {
            return Canonicalizer.canonicalize(text).lines().toList();
        } catch (DocumentParseException e) {
            logger.debug("Diffing raw text, document does not parse: {}", e.getMessage());
            return text.lines().toList();
        }
    }
}
