package org.javai.shuuten.context;

/**
 * A pushed context that is popped when the scope closes.
 *
 * <pre>{@code
 * try (ContextScope scope = contexts.open(envelope, "nightly-billing")) {
 *     runJob();
 * }
 * }</pre>
 */
public final class ContextScope implements AutoCloseable {

    private final RuntimeContexts contexts;
    private final ContextToken token;

    ContextScope(RuntimeContexts contexts, ContextToken token) {
        this.contexts = contexts;
        this.token = token;
    }

    public RuntimeContext context() {
        return token.context();
    }

    public ContextToken token() {
        return token;
    }

    @Override
    public void close() {
        contexts.reset(token);
    }
}
