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
package net.boyechko.vm.optimize.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.vm.optimize.core.VerbosityLevel;
import net.boyechko.vm.optimize.ui.cli.VmOptimizeCLI.CLIConfig;
import net.boyechko.vm.optimize.ui.cli.VmOptimizeCLI.CLIException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VmOptimizeCLITest {
    @TempDir Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path boxesXml;

    @BeforeEach
    void copyFixture() throws IOException {
        boxesXml = tempDir.resolve("fedora.xml");
        try (InputStream in = getClass().getResourceAsStream("/domains/boxes-fedora.xml")) {
            Files.copy(in, boxesXml);
        }
    }

    private int run(String input, String... args) {
        return VmOptimizeCLI.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                new BufferedReader(new StringReader(input)));
    }

    // ── Argument parsing ────────────────────────────────────────────

    @Test
    void defaultsToInteractiveRegistryMode() throws CLIException {
        CLIConfig config = VmOptimizeCLI.parseArguments(new String[0]);

        assertFalse(config.fileMode());
        assertNull(config.connectUri());
        assertNull(config.vmName());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
        assertTrue(config.color());
    }

    @Test
    void parsesRegistryOptions() throws CLIException {
        CLIConfig config =
                VmOptimizeCLI.parseArguments(
                        new String[] {"-c", "qemu:///system", "--vm", "win11", "-n", "-y", "-vv"});

        assertEquals("qemu:///system", config.connectUri());
        assertEquals("win11", config.vmName());
        assertTrue(config.dryRun());
        assertTrue(config.assumeYes());
        assertEquals(VerbosityLevel.DEBUG, config.verbosity());
    }

    @Test
    void fileModeDerivesOutputName() throws CLIException {
        CLIConfig config =
                VmOptimizeCLI.parseArguments(new String[] {"-f", boxesXml.toString()});

        assertTrue(config.fileMode());
        assertEquals(tempDir.resolve("fedora_optimized.xml"), config.outputFile());
    }

    @Test
    void outputDirectoryGetsDerivedFileName() throws CLIException, IOException {
        Path outDir = Files.createDirectory(tempDir.resolve("out"));

        CLIConfig config =
                VmOptimizeCLI.parseArguments(
                        new String[] {"--file", boxesXml.toString(), "-o", outDir.toString()});

        assertEquals(outDir.resolve("fedora_optimized.xml"), config.outputFile());
    }

    @Test
    void reportFlagNamesReportAfterInput() throws CLIException {
        CLIConfig auto =
                VmOptimizeCLI.parseArguments(new String[] {"-f", boxesXml.toString(), "-r"});
        CLIConfig custom =
                VmOptimizeCLI.parseArguments(new String[] {"--vm", "x", "--report=changes.txt"});

        assertEquals(tempDir.resolve("fedora_optimized.txt"), auto.reportPath());
        assertEquals(Paths.get("changes.txt"), custom.reportPath());
    }

    @Test
    void rejectsConflictingAndIncompleteOptions() {
        assertThrows(
                CLIException.class,
                () ->
                        VmOptimizeCLI.parseArguments(
                                new String[] {"-c", "qemu:///system", "-d", "."}));
        assertThrows(
                CLIException.class,
                () ->
                        VmOptimizeCLI.parseArguments(
                                new String[] {"-f", boxesXml.toString(), "--vm", "x"}));
        assertThrows(
                CLIException.class,
                () -> VmOptimizeCLI.parseArguments(new String[] {"-o", "out.xml"}));
        assertThrows(CLIException.class, () -> VmOptimizeCLI.parseArguments(new String[] {"--vm"}));
        assertThrows(
                CLIException.class, () -> VmOptimizeCLI.parseArguments(new String[] {"--bogus"}));
        assertThrows(
                CLIException.class,
                () ->
                        VmOptimizeCLI.parseArguments(
                                new String[] {"-f", tempDir.resolve("absent.xml").toString()}));
    }

    // ── End-to-end runs ─────────────────────────────────────────────

    @Test
    void helpExitsCleanly() {
        assertEquals(VmOptimizeCLI.EXIT_OK, run("", "--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage: vm-optimize"));
    }

    @Test
    void fileModeWritesOptimizedXml() throws IOException {
        int status = run("", "--no-color", "-f", boxesXml.toString());

        assertEquals(VmOptimizeCLI.EXIT_OK, status);
        String written = Files.readString(tempDir.resolve("fedora_optimized.xml"));
        assertTrue(written.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"));
        assertTrue(written.contains("<target dev=\"vda\" bus=\"virtio\"/>"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Proposed optimizations"));
    }

    @Test
    void dryRunWritesNothing() {
        int status = run("", "--no-color", "-n", "-f", boxesXml.toString());

        assertEquals(VmOptimizeCLI.EXIT_OK, status);
        assertFalse(Files.exists(tempDir.resolve("fedora_optimized.xml")));
    }

    @Test
    void reportFileReceivesConsoleOutput() throws IOException {
        Path report = tempDir.resolve("report.txt");

        run("", "-f", boxesXml.toString(), "--report=" + report);

        String text = Files.readString(report);
        assertTrue(text.contains("Proposed optimizations"));
        assertFalse(text.contains("\u001B["), "Report file must not contain colour codes");
    }

    @Test
    void malformedFileFails() throws IOException {
        Path bad = tempDir.resolve("bad.xml");
        Files.writeString(bad, "<domain><devices></domain>");

        assertEquals(VmOptimizeCLI.EXIT_FAILURE, run("", "-f", bad.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Invalid domain XML"));
    }

    @Test
    void directoryRegistryCommitsAfterConfirmation() throws IOException {
        Path vms = Files.createDirectory(tempDir.resolve("vms"));
        Files.copy(boxesXml, vms.resolve("fedora.xml"));

        int status = run("1\ny\n", "--no-color", "-d", vms.toString());

        assertEquals(VmOptimizeCLI.EXIT_OK, status);
        String written = Files.readString(vms.resolve("fedora.xml"));
        assertTrue(written.contains("<cpu mode=\"host-passthrough\" check=\"none\""));
    }

    @Test
    void directoryRegistryDeclineKeepsFile() throws IOException {
        Path vms = Files.createDirectory(tempDir.resolve("vms"));
        Files.copy(boxesXml, vms.resolve("fedora.xml"));
        String before = Files.readString(vms.resolve("fedora.xml"));

        int status = run("n\n", "--no-color", "-d", vms.toString(), "--vm", "fedora");

        assertEquals(VmOptimizeCLI.EXIT_OK, status);
        assertEquals(before, Files.readString(vms.resolve("fedora.xml")));
    }

    @Test
    void listPrintsDomainNames() throws IOException {
        Path vms = Files.createDirectory(tempDir.resolve("vms"));
        Files.writeString(vms.resolve("win11.xml"), "<domain/>");
        Files.writeString(vms.resolve("arch.xml"), "<domain/>");

        assertEquals(VmOptimizeCLI.EXIT_OK, run("", "-q", "-l", "-d", vms.toString()));
        assertEquals("arch\nwin11\n", out.toString(StandardCharsets.UTF_8).replace("\r", ""));
    }
}
