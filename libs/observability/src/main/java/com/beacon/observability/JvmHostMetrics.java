package com.beacon.observability;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.RuntimeMXBean;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HostMetrics} read from the JVM management beans.
 * <p>
 * Memory is heap plus non-heap usage as reported by {@link MemoryMXBean}. The host name is
 * resolved once; when resolution fails the {@code HOSTNAME} environment variable is used.
 */
public final class JvmHostMetrics implements HostMetrics {

    private static final Logger log = LoggerFactory.getLogger(JvmHostMetrics.class);

    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
    private final RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
    private final String hostname = resolveHostname();

    @Override
    public long memoryUsedBytes() {
        return memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
    }

    @Override
    public int cpuCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    @Override
    public String hostname() {
        return hostname;
    }

    @Override
    public String runtimeVersion() {
        return Runtime.version().toString();
    }

    @Override
    public Duration uptime() {
        return Duration.ofMillis(runtime.getUptime());
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name: {}", e.getMessage());
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "unknown";
        }
    }
}
