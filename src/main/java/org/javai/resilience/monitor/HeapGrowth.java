package org.javai.resilience.monitor;

/**
 * Heap growth of a snapshot relative to the baseline taken when monitoring started.
 *
 * @param bytes Heap used now minus heap used at baseline; negative when the heap shrank
 * @param percent Growth relative to the baseline heap, 0 when the baseline heap is empty
 */
public record HeapGrowth(long bytes, double percent) {

    public static HeapGrowth between(ProcessSample baseline, ProcessSample current) {
        long growth = current.heapUsed() - baseline.heapUsed();
        double percent = baseline.heapUsed() > 0
                ? (growth / (double) baseline.heapUsed()) * 100.0
                : 0.0;
        return new HeapGrowth(growth, percent);
    }

    public double megabytes() {
        return ProcessSample.toMb(bytes);
    }
}
