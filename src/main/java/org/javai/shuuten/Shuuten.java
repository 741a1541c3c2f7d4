package org.javai.shuuten;

import org.javai.shuuten.boundary.Capture;
import org.javai.shuuten.context.ContextToken;

import java.util.List;

/**
 * Process-wide entry point.
 *
 * <p>{@link #init()} wires the pipeline from system properties and environment variables.
 * It is idempotent: a warm Lambda container calling it on every invocation keeps the first
 * runtime, along with its dedup history. Pass {@code reset = true} to replace it.
 *
 * <pre>{@code
 * public class BillingHandler implements RequestHandler<Map<String, Object>, String> {
 *
 *     private static final RequestHandler<Map<String, Object>, String> CAPTURED =
 *             Shuuten.capture().workflow("nightly-billing").build().wrap(new BillingJob());
 *
 *     public String handleRequest(Map<String, Object> input, Context context) {
 *         return CAPTURED.handleRequest(input, context);
 *     }
 * }
 * }</pre>
 */
public final class Shuuten {

    private static volatile ShuutenRuntime runtime;

    private Shuuten() {
        // Static facade
    }

    public static ShuutenRuntime init() {
        return init(ShuutenConfig.fromEnvironment(), false);
    }

    public static ShuutenRuntime init(ShuutenConfig config) {
        return init(config, false);
    }

    /**
     * @param reset replace an existing runtime instead of keeping it
     */
    public static synchronized ShuutenRuntime init(ShuutenConfig config, boolean reset) {
        if (runtime != null && !reset) {
            return runtime;
        }
        return install(ShuutenRuntime.builder(config).build());
    }

    /**
     * Installs a pre-built runtime, closing any previous one.
     */
    public static synchronized ShuutenRuntime install(ShuutenRuntime replacement) {
        ShuutenRuntime previous = runtime;
        runtime = replacement;
        if (previous != null && previous != replacement) {
            previous.close();
        }
        return replacement;
    }

    /**
     * Returns the active runtime, initialising from the environment on first use.
     */
    public static ShuutenRuntime runtime() {
        ShuutenRuntime current = runtime;
        return current != null ? current : init();
    }

    public static boolean isInitialized() {
        return runtime != null;
    }

    public static EventLogger getLogger(String name) {
        return runtime().getLogger(name);
    }

    public static EventLogger getLogger(Class<?> type) {
        return runtime().getLogger(type.getName());
    }

    public static Capture.Builder capture() {
        return runtime().capture();
    }

    public static List<DestinationResult> notify(LogEvent event) {
        return runtime().notify(event);
    }

    public static List<DestinationResult> notify(Severity level, String summary, Throwable failure) {
        return runtime().notify(level, summary, failure);
    }

    public static ContextToken detectAndSetContext(Object envelope) {
        return runtime().detectAndSetContext(envelope);
    }

    public static ContextToken detectAndSetContext(Object envelope, String workflow) {
        return runtime().detectAndSetContext(envelope, workflow);
    }

    public static void reset(ContextToken token) {
        runtime().reset(token);
    }

    /**
     * Closes the active runtime. The next call initialises a fresh one.
     */
    public static synchronized void shutdown() {
        ShuutenRuntime current = runtime;
        runtime = null;
        if (current != null) {
            current.close();
        }
    }
}
