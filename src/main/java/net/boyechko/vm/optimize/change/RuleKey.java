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
package net.boyechko.vm.optimize.change;

/** Identifies which optimization produced a change, with its fixed explanatory text. */
public enum RuleKey {
    // Storage
    DISK_BUS(
            "disk_bus",
            "Disk bus: IDE/SATA → VirtIO",
            "VirtIO disk provides ~3x throughput, lower CPU overhead, TRIM support"),
    DISK_CACHE(
            "disk_cache",
            "Disk cache: → writeback + discard=unmap + io=threads",
            "Improves write performance and enables SSD TRIM passthrough"),

    // Network
    NIC_MODEL(
            "nic_model",
            "NIC model: rtl8139/e1000 → VirtIO",
            "VirtIO NIC provides ~10x throughput, lower latency"),

    // Display
    VIDEO_MODEL(
            "video_model",
            "Video: QXL/VGA → VirtIO-GPU",
            "Better Wayland support, enables 3D acceleration"),
    VIDEO_ACCEL(
            "video_accel",
            "3D acceleration: Enable",
            "Hardware-accelerated graphics via host GPU"),
    SPICE_GL(
            "spice_gl",
            "SPICE GL: Enable with rendernode",
            "GPU passthrough for display, reduces CPU usage"),

    // Processor
    CPU_MODE("cpu_mode", "CPU mode: → host-passthrough", "Exposes full host CPU features to guest"),
    CPU_TOPOLOGY(
            "cpu_topology",
            "CPU topology: Add cores/threads layout",
            "Helps guest scheduler optimize thread placement");

    private final String key;
    private final String description;
    private final String detail;

    RuleKey(String key, String description, String detail) {
        this.key = key;
        this.description = description;
        this.detail = detail;
    }

    /** The snake_case key used in change logs, e.g. {@code disk_bus}. */
    public String key() {
        return key;
    }

    public String description() {
        return description;
    }

    public String detail() {
        return detail;
    }

    /** Looks up a rule by its snake_case key. */
    public static RuleKey fromKey(String key) {
        for (RuleKey rule : values()) {
            if (rule.key.equals(key)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown rule key: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
