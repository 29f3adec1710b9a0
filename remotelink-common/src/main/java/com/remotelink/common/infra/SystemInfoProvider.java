package com.remotelink.common.infra;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only view of host state. Every call computes a fresh snapshot.
 */
public class SystemInfoProvider {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    /** Free heap below this share of max heap reports {@link #DEGRADED}. */
    static final double MIN_FREE_HEAP_RATIO = 0.05;

    private static final long MB = 1024L * 1024L;

    public record HealthSnapshot(
            String name,
            String status,
            @JsonProperty("last_health_check") String lastHealthCheck) {

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", name);
            map.put("status", status);
            map.put("last_health_check", lastHealthCheck);
            return map;
        }
    }

    private final Supplier<String> clientName;

    public SystemInfoProvider(Supplier<String> clientName) {
        this.clientName = clientName;
    }

    public HealthSnapshot snapshot() {
        Runtime rt = Runtime.getRuntime();
        long used = rt.totalMemory() - rt.freeMemory();
        return new HealthSnapshot(clientName.get(), statusFor(rt.maxMemory(), used),
                Instant.now().toString());
    }

    /**
     * Host name, OS, CPU, memory and disk figures for the system endpoint.
     */
    public Map<String, Object> hostInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", clientName.get());
        info.put("hostname", MachineDisplayName.get());

        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        Map<String, Object> osInfo = new LinkedHashMap<>();
        osInfo.put("name", os.getName());
        osInfo.put("version", os.getVersion());
        osInfo.put("arch", os.getArch());
        info.put("os", osInfo);

        Map<String, Object> cpu = new LinkedHashMap<>();
        cpu.put("count", os.getAvailableProcessors());
        double load = os.getSystemLoadAverage();
        if (load >= 0) {
            cpu.put("load_average", load);
        }
        info.put("cpu", cpu);

        Runtime rt = Runtime.getRuntime();
        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("total_mb", rt.totalMemory() / MB);
        memory.put("free_mb", rt.freeMemory() / MB);
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / MB);
        memory.put("max_mb", rt.maxMemory() / MB);
        info.put("memory", memory);

        File root = new File(File.separator);
        Map<String, Object> disk = new LinkedHashMap<>();
        disk.put("path", root.getAbsolutePath());
        disk.put("total_mb", root.getTotalSpace() / MB);
        disk.put("free_mb", root.getUsableSpace() / MB);
        info.put("disk", disk);

        info.put("uptime_ms", ManagementFactory.getRuntimeMXBean().getUptime());
        info.put("java_version", System.getProperty("java.version"));
        return info;
    }

    static String statusFor(long maxHeap, long usedHeap) {
        if (maxHeap <= 0 || maxHeap == Long.MAX_VALUE) {
            return HEALTHY;
        }
        double freeRatio = (double) (maxHeap - usedHeap) / maxHeap;
        return freeRatio < MIN_FREE_HEAP_RATIO ? DEGRADED : HEALTHY;
    }
}
