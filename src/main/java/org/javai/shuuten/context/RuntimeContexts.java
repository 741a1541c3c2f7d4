package org.javai.shuuten.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Per-thread stack of active {@link RuntimeContext}s.
 *
 * <p>Each thread sees only the contexts it pushed itself; nothing is inherited by child
 * threads. Use {@link #propagating(Runnable)} to carry the current context into work
 * handed to an executor.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * ContextToken token = contexts.detectAndSetContext(lambdaContext);
 * try {
 *     handle(event);
 * } finally {
 *     contexts.reset(token);
 * }
 * }</pre>
 */
public final class RuntimeContexts {

    private static final Logger log = LoggerFactory.getLogger(RuntimeContexts.class);

    private final ThreadLocal<Deque<ContextToken>> stack = new ThreadLocal<>();
    private final ContextDetector detector;

    public RuntimeContexts(ContextDetector detector) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
    }

    public ContextDetector detector() {
        return detector;
    }

    /**
     * Classifies the invocation envelope, builds a context and pushes it. Never throws.
     *
     * @param envelope the platform-supplied context object, a map, or null
     * @return a token for {@link #reset}
     */
    public ContextToken detectAndSetContext(Object envelope) {
        return setContext(detector.detect(envelope));
    }

    /**
     * Like {@link #detectAndSetContext(Object)}, tagging the context with a workflow label.
     */
    public ContextToken detectAndSetContext(Object envelope, String workflow) {
        RuntimeContext detected = detector.detect(envelope);
        return setContext(workflow == null ? detected : detected.withWorkflow(workflow));
    }

    /**
     * Pushes an explicit context, shadowing whatever is active on this thread.
     */
    public ContextToken setContext(RuntimeContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Deque<ContextToken> frames = stack.get();
        if (frames == null) {
            frames = new ArrayDeque<>();
            stack.set(frames);
        }
        ContextToken token = new ContextToken(context, Thread.currentThread().getId());
        frames.push(token);
        return token;
    }

    /**
     * Restores the context that was active before the token's push.
     *
     * <p>Frames pushed after the token are discarded too. Resetting a stale token, a token
     * that was already reset, or a token from another thread does nothing.
     */
    public void reset(ContextToken token) {
        if (token == null) {
            return;
        }
        if (token.threadId() != Thread.currentThread().getId()) {
            log.debug("Ignoring reset of {} from a different thread", token);
            return;
        }
        Deque<ContextToken> frames = stack.get();
        if (frames == null || !frames.contains(token)) {
            return;
        }
        ContextToken popped;
        do {
            popped = frames.pop();
        } while (popped != token);
        if (frames.isEmpty()) {
            stack.remove();
        }
    }

    /**
     * Returns the innermost active context on this thread.
     */
    public Optional<RuntimeContext> current() {
        Deque<ContextToken> frames = stack.get();
        if (frames == null || frames.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(frames.peek().context());
    }

    /**
     * Returns the innermost active context, or a newly detected one (not pushed) when none is active.
     */
    public RuntimeContext currentOrDetected() {
        return current().orElseGet(() -> detector.detect(null));
    }

    /**
     * Returns the number of active contexts on this thread.
     */
    public int depth() {
        Deque<ContextToken> frames = stack.get();
        return frames == null ? 0 : frames.size();
    }

    public ContextScope open(Object envelope, String workflow) {
        return new ContextScope(this, detectAndSetContext(envelope, workflow));
    }

    public ContextScope open(RuntimeContext context) {
        return new ContextScope(this, setContext(context));
    }

    /**
     * Wraps a task so that it runs with the caller's current context active.
     */
    public Runnable propagating(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        Optional<RuntimeContext> captured = current();
        return () -> {
            ContextToken token = captured.map(this::setContext).orElse(null);
            try {
                task.run();
            } finally {
                reset(token);
            }
        };
    }

    public <T> Callable<T> propagating(Callable<T> task) {
        Objects.requireNonNull(task, "task must not be null");
        Optional<RuntimeContext> captured = current();
        return () -> {
            ContextToken token = captured.map(this::setContext).orElse(null);
            try {
                return task.call();
            } finally {
                reset(token);
            }
        };
    }
}
