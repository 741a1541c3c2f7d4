package org.javai.shuuten.boundary;

/**
 * A handler entry point of the common {@code (event, context)} shape, for hosts other than
 * the Lambda {@code RequestHandler} interface.
 *
 * @param <E> The invocation payload
 * @param <C> The platform context object used for runtime detection
 * @param <R> The result type
 * @param <X> The checked exception the handler may throw
 */
@FunctionalInterface
public interface InvocationHandler<E, C, R, X extends Exception> {

    R handle(E event, C context) throws X;
}
