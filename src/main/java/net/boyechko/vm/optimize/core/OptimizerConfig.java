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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Tunable settings, loaded from YAML. Field names match the YAML keys.
 *
 * <p>Lookup order for {@link #loadDefault()}:
 *
 * <ol>
 *   <li>system property {@code vmoptimize.config} naming a YAML file
 *   <li>environment variable {@code VM_OPTIMIZE_CONFIG} naming a YAML file
 *   <li>the bundled {@code /vm-optimize.yaml} resource
 * </ol>
 */
public final class OptimizerConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/vm-optimize.yaml";
    private static final String CONFIG_PROPERTY = "vmoptimize.config";
    private static final String CONFIG_ENV = "VM_OPTIMIZE_CONFIG";
    private static final Logger logger = LoggerFactory.getLogger(OptimizerConfig.class);

    public Report report = new Report();
    public Spice spice = new Spice();
    public Virsh virsh = new Virsh();

    public static final class Report {
        /** Diff lines shown before the "N more lines" marker. */
        public int max_diff_lines = 50;

        public int diff_context_lines = 3;
    }

    public static final class Spice {
        /** DRM render node used when a SPICE {@code <gl>} element has none. */
        public String rendernode = "/dev/dri/renderD128";
    }

    public static final class Virsh {
        public String binary = "virsh";
        public String default_uri = "qemu:///session";
        public int timeout_seconds = 30;
    }

    /** Built-in defaults, without reading any file. */
    public static OptimizerConfig defaults() {
        return new OptimizerConfig();
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static OptimizerConfig fromResource(String resourcePath) {
        try (InputStream in = OptimizerConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(in, resourcePath);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read configuration resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load configuration from a YAML file on disk. */
    public static OptimizerConfig fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /** Load configuration from the override location if one is set, else the bundled default. */
    public static OptimizerConfig loadDefault() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override == null) {
            override = System.getenv(CONFIG_ENV);
        }
        if (override != null && !override.isBlank()) {
            logger.debug("Using configuration override {}", override);
            return fromFile(Path.of(override));
        }
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static OptimizerConfig load(InputStream in, String origin) {
        OptimizerConfig config;
        try {
            Yaml yaml = new Yaml(new Constructor(OptimizerConfig.class, new LoaderOptions()));
            config = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException(
                    "Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            logger.debug("Configuration {} is empty; using defaults", origin);
            config = new OptimizerConfig();
        }
        config.fillMissingSections();

        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid configuration in " + origin + ": " + String.join("; ", problems));
        }
        logger.debug("Loaded configuration from {}", origin);
        return config;
    }

    private void fillMissingSections() {
        if (report == null) {
            report = new Report();
        }
        if (spice == null) {
            spice = new Spice();
        }
        if (virsh == null) {
            virsh = new Virsh();
        }
    }

    /**
     * Checks value ranges and returns a list of problems.
     *
     * @return problem descriptions (empty if the configuration is usable)
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (report.max_diff_lines < 0) {
            problems.add("report.max_diff_lines must not be negative");
        }
        if (report.diff_context_lines < 0) {
            problems.add("report.diff_context_lines must not be negative");
        }
        if (spice.rendernode == null || spice.rendernode.isBlank()) {
            problems.add("spice.rendernode must not be blank");
        }
        if (virsh.binary == null || virsh.binary.isBlank()) {
            problems.add("virsh.binary must not be blank");
        }
        if (virsh.default_uri == null || virsh.default_uri.isBlank()) {
            problems.add("virsh.default_uri must not be blank");
        }
        if (virsh.timeout_seconds <= 0) {
            problems.add("virsh.timeout_seconds must be positive");
        }
        return problems;
    }
}
