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

import ch.qos.logback.classic.Level;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import net.boyechko.vm.optimize.core.ConfirmationGate;
import net.boyechko.vm.optimize.core.OptimizationDefaults;
import net.boyechko.vm.optimize.core.OptimizationResult;
import net.boyechko.vm.optimize.core.OptimizationService;
import net.boyechko.vm.optimize.core.OptimizationStatus;
import net.boyechko.vm.optimize.core.OptimizerConfig;
import net.boyechko.vm.optimize.core.VerbosityLevel;
import net.boyechko.vm.optimize.document.DocumentParseException;
import net.boyechko.vm.optimize.registry.DirectoryDomainRegistry;
import net.boyechko.vm.optimize.registry.DomainInfo;
import net.boyechko.vm.optimize.registry.DomainRegistry;
import net.boyechko.vm.optimize.registry.RegistryException;
import net.boyechko.vm.optimize.report.ReportView;
import net.boyechko.vm.optimize.ui.ConsolePrompter;
import net.boyechko.vm.optimize.ui.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VmOptimizeCLI {
    private static final String DEFAULT_OUTPUT_SUFFIX = "_optimized";
    private static final String DEFAULT_REPORT_NAME = "vm-optimize-report.txt";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            String connectUri,
            Path directory,
            String vmName,
            Path inputFile,
            Path outputFile,
            boolean listOnly,
            boolean dryRun,
            boolean assumeYes,
            boolean force,
            Path configPath,
            Path reportPath,
            boolean color,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputFile != null && outputFile == null) {
                throw new IllegalArgumentException("Output path is required in file mode");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }

        public boolean fileMode() {
            return inputFile != null;
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        String connectUri;
        Path directory;
        String vmName;
        Path inputFile;
        Path outputFile;
        boolean listOnly;
        boolean dryRun;
        boolean assumeYes;
        boolean force;
        Path configPath;
        boolean generateReport;
        Path reportPath;
        boolean color = true;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (connectUri != null && directory != null) {
                throw new CLIException("--connect and --dir cannot be combined");
            }
            if (inputFile != null) {
                if (connectUri != null || directory != null || vmName != null || listOnly) {
                    throw new CLIException(
                            "--file cannot be combined with --connect, --dir, --vm or --list");
                }
                if (!Files.isRegularFile(inputFile)) {
                    throw new CLIException("File not found: " + inputFile);
                }
            } else if (outputFile != null) {
                throw new CLIException("--output requires --file");
            }
            if (directory != null && !Files.isDirectory(directory)) {
                throw new CLIException("Directory not found: " + directory);
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Configuration file not found: " + configPath);
            }

            String baseName =
                    inputFile == null
                            ? null
                            : inputFile
                                    .getFileName()
                                    .toString()
                                    .replaceFirst("(" + DEFAULT_OUTPUT_SUFFIX + ")*[.][^.]+$", "");
            resolveOutputPath(baseName);
            resolveReportPath(baseName);

            return new CLIConfig(
                    connectUri,
                    directory,
                    vmName,
                    inputFile,
                    outputFile,
                    listOnly,
                    dryRun,
                    assumeYes,
                    force,
                    configPath,
                    reportPath,
                    color,
                    verbosity);
        }

        private void resolveOutputPath(String baseName) {
            if (inputFile == null) {
                return;
            }
            String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".xml";
            if (outputFile == null) {
                outputFile = inputFile.resolveSibling(outputFilename);
            } else if (Files.isDirectory(outputFile)) {
                outputFile = outputFile.resolve(outputFilename);
            }
        }

        private void resolveReportPath(String baseName) {
            String reportFilename =
                    baseName != null
                            ? baseName + DEFAULT_OUTPUT_SUFFIX + ".txt"
                            : DEFAULT_REPORT_NAME;
            if (generateReport && reportPath == null) {
                reportPath =
                        inputFile != null
                                ? inputFile.resolveSibling(reportFilename)
                                : Paths.get(reportFilename);
            } else if (reportPath != null && Files.isDirectory(reportPath)) {
                reportPath = reportPath.resolve(reportFilename);
            }
        }
    }

    public static void main(String[] args) {
        BufferedReader stdin =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, System.out, System.err, stdin));
    }

    /** Runs the tool and returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err, BufferedReader in) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return EXIT_OK;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info("Starting with verbosity level {}", config.verbosity());
            return execute(config, out, err, in);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--report=")) {
                b.reportPath = Paths.get(args[i].substring("--report=".length()));
                b.generateReport = true;
            } else if (args[i].startsWith("-r=")) {
                b.reportPath = Paths.get(args[i].substring("-r=".length()));
                b.generateReport = true;
            } else {
                switch (args[i]) {
                    case "-c", "--connect", "--uri" -> b.connectUri = requireValue(args, ++i);
                    case "-d", "--dir" -> b.directory = Paths.get(requireValue(args, ++i));
                    case "--vm" -> b.vmName = requireValue(args, ++i);
                    case "-f", "--file" -> b.inputFile = Paths.get(requireValue(args, ++i));
                    case "-o", "--output" -> b.outputFile = Paths.get(requireValue(args, ++i));
                    case "--config" -> b.configPath = Paths.get(requireValue(args, ++i));
                    case "-l", "--list" -> b.listOnly = true;
                    case "-n", "--dry-run" -> b.dryRun = true;
                    case "-y", "--yes" -> b.assumeYes = true;
                    case "--force" -> b.force = true;
                    case "--no-color" -> b.color = false;
                    case "-r", "--report" -> b.generateReport = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        }
                        throw new CLIException("Unexpected argument: " + args[i]);
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int index) throws CLIException {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new CLIException("Value not specified after " + args[index - 1]);
        }
        return args[index];
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger)
                        LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(VmOptimizeCLI.class);
        }
        return logger;
    }

    private static int execute(
            CLIConfig config, PrintStream out, PrintStream err, BufferedReader in) {
        OutputStream reportFile = null;
        PrintStream output = out;
        ConsoleReporter reporter = null;

        try {
            reportFile = openReportStream(config);
            if (reportFile != null) {
                output =
                        new PrintStream(
                                new TeeOutputStream(out, reportFile), true, StandardCharsets.UTF_8);
            }

            OptimizerConfig optimizerConfig =
                    config.configPath() != null
                            ? OptimizerConfig.fromFile(config.configPath())
                            : OptimizerConfig.loadDefault();
            boolean color = config.color() && reportFile == null;
            reporter = new ConsoleReporter(output, config.verbosity(), color);

            if (config.fileMode()) {
                return optimizeFile(config, optimizerConfig, reporter);
            }
            return optimizeRegistryDomain(config, optimizerConfig, reporter, output, in);
        } catch (DocumentParseException e) {
            err.println("✗ Invalid domain XML: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RegistryException e) {
            err.println("✗ " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | IllegalArgumentException e) {
            err.println("✗ " + e.getMessage());
            logger().debug("Run failed", e);
            return EXIT_FAILURE;
        } finally {
            if (reporter != null) {
                reporter.finish();
                reporter.detach();
            }
            if (reportFile != null) {
                output.flush();
                try {
                    reportFile.close();
                } catch (IOException e) {
                    logger().warn("Failed to close report file", e);
                }
            }
        }
    }

    private static int optimizeFile(
            CLIConfig config, OptimizerConfig optimizerConfig, ConsoleReporter reporter)
            throws IOException, DocumentParseException {
        OptimizationService service =
                OptimizationService.builder()
                        .withConfig(optimizerConfig)
                        .withListener(reporter)
                        .build();

        reporter.onPhaseStart("Analyzing " + config.inputFile().getFileName());
        String xml = Files.readString(config.inputFile(), StandardCharsets.UTF_8);
        OptimizationResult result = service.optimizeText(xml);
        reporter.onReport(result.report());

        if (!result.hasChanges()) {
            reporter.onSuccess(ReportView.ALREADY_OPTIMIZED);
            if (!config.force()) {
                return EXIT_OK;
            }
        }
        if (config.dryRun()) {
            reporter.onInfo("Dry run: output file not written");
            return EXIT_OK;
        }

        Path outputParent = config.outputFile().toAbsolutePath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }
        logger().info("Writing optimized XML to {}", config.outputFile());
        Files.writeString(config.outputFile(), result.optimizedXml(), StandardCharsets.UTF_8);
        reporter.onSuccess("Output saved to " + config.outputFile());
        return EXIT_OK;
    }

    private static int optimizeRegistryDomain(
            CLIConfig config,
            OptimizerConfig optimizerConfig,
            ConsoleReporter reporter,
            PrintStream output,
            BufferedReader in)
            throws RegistryException, DocumentParseException {
        DomainRegistry registry =
                config.directory() != null
                        ? new DirectoryDomainRegistry(config.directory())
                        : OptimizationDefaults.virshRegistry(optimizerConfig, config.connectUri());
        reporter.onInfo("Connecting to " + registry.describe());

        ConsolePrompter prompter = new ConsolePrompter(in, output);

        if (config.listOnly()) {
            List<DomainInfo> domains = registry.listDomains();
            for (DomainInfo domain : domains) {
                output.println(domain.name() + (domain.active() ? " (running)" : ""));
            }
            return EXIT_OK;
        }

        String vmName = config.vmName();
        if (vmName == null) {
            Optional<String> selected = prompter.select(registry.listDomains());
            if (selected.isEmpty()) {
                return EXIT_OK;
            }
            vmName = selected.get();
        }

        OptimizationService service =
                OptimizationService.builder()
                        .withRegistry(registry)
                        .withConfig(optimizerConfig)
                        .withListener(reporter)
                        .withConfirmationGate(
                                config.assumeYes() ? ConfirmationGate.APPROVE_ALL : prompter)
                        .dryRun(config.dryRun())
                        .build();

        OptimizationResult result = service.optimizeDomain(vmName);
        return result.status() == OptimizationStatus.COMMIT_FAILED ? EXIT_FAILURE : EXIT_OK;
    }

    private static OutputStream openReportStream(CLIConfig config) throws IOException {
        if (config.reportPath() == null) {
            return null;
        }
        Path reportParent = config.reportPath().toAbsolutePath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        logger().info("Saving report to {}", config.reportPath());
        return Files.newOutputStream(config.reportPath());
    }

    /** Writes to two output streams simultaneously, like the Unix tee command. */
    private static class TeeOutputStream extends OutputStream {
        private final OutputStream out1;
        private final OutputStream out2;

        TeeOutputStream(OutputStream out1, OutputStream out2) {
            this.out1 = out1;
            this.out2 = out2;
        }

        @Override
        public void write(int b) throws IOException {
            out1.write(b);
            out2.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out1.write(b, off, len);
            out2.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            out1.flush();
            out2.flush();
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: vm-optimize [options]\n"
                + "       vm-optimize -f <domain.xml> [-o <output.xml>] [options]\n"
                + "  -h, --help            Show this help message\n"
                + "  -c, --connect <uri>   Libvirt connection URI (default: qemu:///session)\n"
                + "  -d, --dir <path>      Use a directory of <name>.xml files instead of virsh\n"
                + "  --vm <name>           VM name (skip interactive selection)\n"
                + "  -l, --list            List VMs and exit\n"
                + "  -f, --file <xml>      Optimize a domain XML file instead of a registry VM\n"
                + "  -o, --output <xml>    Output file for --file (default: <name>_optimized.xml)\n"
                + "  -n, --dry-run         Show changes without applying them\n"
                + "  -y, --yes             Skip the confirmation prompt\n"
                + "  --force               Write the output file even if nothing changed\n"
                + "  --config <yaml>       Load settings from a YAML file\n"
                + "  -r, --report          Save output to a report file (auto-named)\n"
                + "                        Use -r=<file> or --report=<file> for a custom path\n"
                + "  --no-color            Disable ANSI colours\n"
                + "  -q, --quiet           Only show errors and final status\n"
                + "  -v, --verbose         Show processing steps\n"
                + "  -vv, --debug          Show all debug information\n"
                + "Examples:\n"
                + "  vm-optimize                          Interactive mode (GNOME Boxes VMs)\n"
                + "  vm-optimize -c qemu:///system        System VMs\n"
                + "  vm-optimize --vm my-vm --dry-run     Show changes without applying\n"
                + "  vm-optimize -f win11.xml -o out.xml  Optimize a saved XML file";
    }
}
