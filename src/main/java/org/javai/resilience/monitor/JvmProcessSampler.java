package org.javai.resilience.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.management.BufferPoolMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Samples the running JVM through the platform MXBeans.
 *
 * <p>The resident set size is read from {@code /proc/self/status} where available. On other
 * platforms it is approximated by committed heap plus committed non-heap memory.
 */
final class JvmProcessSampler implements ProcessSampler {

    private static final Logger LOG = LogManager.getLogger(JvmProcessSampler.class);
    private static final Path PROC_STATUS = Path.of("/proc/self/status");

    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
    private final List<BufferPoolMXBean> bufferPools =
            ManagementFactory.getPlatformMXBeans(BufferPoolMXBean.class);
    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private volatile boolean procAvailable = Files.isReadable(PROC_STATUS);

    @Override
    public ProcessSample sample() {
        MemoryUsage heap = memory.getHeapMemoryUsage();
        MemoryUsage nonHeap = memory.getNonHeapMemoryUsage();

        long direct = 0;
        for (BufferPoolMXBean pool : bufferPools) {
            direct += Math.max(0, pool.getMemoryUsed());
        }

        long rss = readResidentSet();
        if (rss < 0) {
            rss = heap.getCommitted() + nonHeap.getCommitted();
        }

        return new ProcessSample(
                heap.getUsed(),
                heap.getCommitted(),
                nonHeap.getUsed() + direct,
                rss,
                processCpuTime(),
                ManagementFactory.getRuntimeMXBean().getUptime()
        );
    }

    private long processCpuTime() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return sunOs.getProcessCpuTime();
        }
        return -1;
    }

    private long readResidentSet() {
        if (!procAvailable) {
            return -1;
        }
        try {
            for (String line : Files.readAllLines(PROC_STATUS)) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]) * 1024L;
                }
            }
            return -1;
        } catch (IOException | NumberFormatException e) {
            LOG.debug("Resident set size unavailable from {}, falling back to committed memory: {}",
                    PROC_STATUS, e.getMessage());
            procAvailable = false;
            return -1;
        }
    }
}
