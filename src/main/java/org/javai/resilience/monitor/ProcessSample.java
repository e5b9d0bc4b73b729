package org.javai.resilience.monitor;

/**
 * Process-level memory and CPU counters.
 *
 * @param heapUsed Heap bytes in use
 * @param heapTotal Heap bytes committed
 * @param external Memory outside the heap (non-heap pools and direct buffers), in bytes
 * @param residentSet Resident set size in bytes
 * @param cpuTimeNanos CPU time consumed by the process, or -1 if the runtime does not report it
 * @param uptimeMillis Process uptime
 */
public record ProcessSample(
        long heapUsed,
        long heapTotal,
        long external,
        long residentSet,
        long cpuTimeNanos,
        long uptimeMillis
) {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public static ProcessSample ofHeap(long heapUsed, long heapTotal) {
        return new ProcessSample(heapUsed, heapTotal, 0, heapTotal, -1, 0);
    }

    public double heapUsedMb() {
        return toMb(heapUsed);
    }

    public double heapTotalMb() {
        return toMb(heapTotal);
    }

    public double externalMb() {
        return toMb(external);
    }

    public double residentSetMb() {
        return toMb(residentSet);
    }

    static double toMb(long bytes) {
        return Math.round(bytes / BYTES_PER_MB * 100.0) / 100.0;
    }
}
