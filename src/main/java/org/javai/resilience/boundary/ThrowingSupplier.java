package org.javai.resilience.boundary;

/**
 * Work guarded by {@link ErrorBoundary#call(String, ThrowingSupplier)}.
 *
 * @param <T> The result type
 * @param <E> The checked exception the work may throw
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
