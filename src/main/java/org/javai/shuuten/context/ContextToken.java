package org.javai.shuuten.context;

/**
 * Handle returned when a context is pushed; pass it to {@link RuntimeContexts#reset} to pop.
 *
 * <p>Tokens are bound to the thread that created them. A token can be reset at most once;
 * further resets are ignored.
 */
public final class ContextToken {

    private final RuntimeContext context;
    private final long threadId;

    ContextToken(RuntimeContext context, long threadId) {
        this.context = context;
        this.threadId = threadId;
    }

    public RuntimeContext context() {
        return context;
    }

    long threadId() {
        return threadId;
    }

    @Override
    public String toString() {
        return "ContextToken[" + context.invocationId() + "]";
    }
}
