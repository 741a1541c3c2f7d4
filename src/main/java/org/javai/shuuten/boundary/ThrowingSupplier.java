package org.javai.shuuten.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Capture#call} to run a unit of work.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
