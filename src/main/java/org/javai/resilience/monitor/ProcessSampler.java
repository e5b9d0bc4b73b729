package org.javai.resilience.monitor;

/**
 * Reads the current process counters.
 */
@FunctionalInterface
public interface ProcessSampler {

    ProcessSample sample();

    static ProcessSampler jvm() {
        return new JvmProcessSampler();
    }
}
