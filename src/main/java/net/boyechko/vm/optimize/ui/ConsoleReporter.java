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
package net.boyechko.vm.optimize.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.vm.optimize.core.OptimizationListener;
import net.boyechko.vm.optimize.core.VerbosityLevel;
import net.boyechko.vm.optimize.report.ChangeDescription;
import net.boyechko.vm.optimize.report.ReportView;
import org.slf4j.LoggerFactory;

/** Renders optimization progress and reports to a console stream inside box-drawn sections. */
public class ConsoleReporter implements OptimizationListener {
    static final String APP_LOGGER = "net.boyechko.vm.optimize";

    private final PrintStream output;
    private final VerbosityLevel verbosity;
    private final boolean color;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "✗";
    private static final String WARNING = "⚠";
    private static final String INFO = "○";
    private static final String CHANGE = "●";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_DIM = "\u001B[2m";

    private boolean boxOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ConsoleReporter(PrintStream output, VerbosityLevel verbosity, boolean color) {
        this.output = output;
        this.verbosity = verbosity;
        this.color = color;
        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            closeBoxIfOpen();
            printBoxHeader(phaseName);
        }
    }

    @Override
    public void onReport(ReportView report) {
        if (report.isAlreadyOptimized()) {
            return;
        }
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            printLine(report.changes().size() + " change(s) proposed", INFO, VerbosityLevel.QUIET);
            return;
        }

        closeBoxIfOpen();
        printBoxHeader("Proposed optimizations");
        for (ChangeDescription change : report.changes()) {
            printLine(paint(change.description(), ANSI_YELLOW), CHANGE);
            printLine("  Before: " + change.before(), " ");
            printLine("  After:  " + paint(change.after(), ANSI_GREEN), " ");
            if (!change.detail().isEmpty()) {
                printLine("  → " + paint(change.detail(), ANSI_DIM), " ");
            }
        }
        printBoxFooter();

        printBoxHeader("XML diff (abbreviated)");
        for (String line : report.diffLines()) {
            output.println(INDENT + colorDiffLine(line));
        }
        if (report.isTruncated()) {
            output.println(INDENT);
            output.println(INDENT + paint(report.truncationMarker(), ANSI_DIM));
        }
        printBoxFooter();
    }

    @Override
    public void onSuccess(String message) {
        printLine(paint(message, ANSI_GREEN), SUCCESS, VerbosityLevel.QUIET);
    }

    @Override
    public void onError(String message) {
        printLine(paint(message, ANSI_RED), ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onWarning(String message) {
        printLine(paint(message, ANSI_YELLOW), WARNING);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    /** Closes any open box and flushes captured log events. */
    public void finish() {
        closeBoxIfOpen();
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            drainLogBuffer();
        }
    }

    /** Detaches the log capture appender from the application logger. */
    public void detach() {
        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        appLogger.detachAppender(logBuffer);
        logBuffer.stop();
    }

    String colorDiffLine(String line) {
        if (line.startsWith("+++") || line.startsWith("---")) {
            return paint(line, ANSI_DIM);
        }
        if (line.startsWith("+")) {
            return paint(line, ANSI_GREEN);
        }
        if (line.startsWith("-")) {
            return paint(line, ANSI_RED);
        }
        if (line.startsWith("@@")) {
            return paint(line, ANSI_CYAN);
        }
        return line;
    }

    private String paint(String text, String ansi) {
        return color ? ansi + text + ANSI_RESET : text;
    }

    private void closeBoxIfOpen() {
        if (boxOpen) {
            printBoxFooter();
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
        boxOpen = true;
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
        boxOpen = false;
    }

    /** Flushes log events captured since the last drain into the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        output.println(boxOpen ? INDENT : "");
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.WARN) ? WARNING : INFO;
            printLine(
                    "[" + event.getLevel() + "] " + event.getFormattedMessage(),
                    icon,
                    VerbosityLevel.QUIET);
        }
    }

    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = boxOpen ? INDENT : "";
        output.println(prefix + icon + " " + message);
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }
}
