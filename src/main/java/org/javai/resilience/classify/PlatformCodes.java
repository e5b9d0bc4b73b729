package org.javai.resilience.classify;

/**
 * Platform error codes the classifier recognises.
 */
public final class PlatformCodes {

    /** Uniqueness or other integrity constraint violated by the data store. */
    public static final String CONSTRAINT = "CONSTRAINT";

    /** The data store is locked or busy. */
    public static final String BUSY = "BUSY";

    public static final String ENOTFOUND = "ENOTFOUND";
    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String EHOSTUNREACH = "EHOSTUNREACH";
    public static final String ETIMEDOUT = "ETIMEDOUT";
    public static final String ENOENT = "ENOENT";

    private PlatformCodes() {
    }
}
