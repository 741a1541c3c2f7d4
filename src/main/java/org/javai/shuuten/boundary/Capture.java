package org.javai.shuuten.boundary;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.Severity;
import org.javai.shuuten.context.ContextScope;
import org.javai.shuuten.context.RuntimeContext;
import org.javai.shuuten.context.RuntimeContexts;
import org.javai.shuuten.context.Source;
import org.javai.shuuten.dispatch.EventInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * The invocation boundary that turns an escaping exception into a notification.
 *
 * <p>Around each invocation a runtime context is detected and pushed. If the work throws,
 * a CRITICAL event describing the exception is handed to the {@link EventInterceptor}, the
 * context is torn down, and the original exception is rethrown unchanged. On success the
 * return value passes through untouched. Teardown happens on every exit path, and a failure
 * while reporting is logged, never thrown in place of the original exception.
 *
 * <p>Per-invocation details can be derived from the handler's input and context argument
 * with {@link Builder#details} and {@link Builder#subjectId}; they are only evaluated when
 * the invocation fails.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Capture capture = Capture.builder()
 *     .interceptor(interceptor)
 *     .contexts(contexts)
 *     .workflow("nightly-billing")
 *     .build();
 *
 * RequestHandler<Map<String, Object>, String> handler = capture.wrap(new BillingHandler());
 *
 * // Or ad hoc
 * Report report = capture.call(null, "build-report", () -> reports.build(day));
 * }</pre>
 */
public final class Capture {

    private static final Logger log = LoggerFactory.getLogger(Capture.class);

    public static final String LOGGER_NAME = "shuuten.capture";
    public static final String SUBJECT_ID = "subject_id";
    public static final String DEFAULT_SUMMARY = "Automation failed";
    static final String DEFAULT_ACTION = "invocation";

    private final EventInterceptor interceptor;
    private final RuntimeContexts contexts;
    private final String workflow;
    private final String summary;
    private final String action;
    private final Source forcedSource;
    private final Map<String, Object> extra;
    private final BiFunction<Object, Object, ? extends Map<String, ?>> details;
    private final BiFunction<Object, Object, String> subjectId;
    private final Clock clock;

    private Capture(Builder builder) {
        this.interceptor = builder.interceptor;
        this.contexts = builder.contexts;
        this.workflow = builder.workflow;
        this.summary = builder.summary;
        this.action = builder.action;
        this.forcedSource = builder.forcedSource;
        this.extra = Map.copyOf(builder.extra);
        this.details = builder.details;
        this.subjectId = builder.subjectId;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wraps a Lambda handler. The Lambda {@link Context} drives runtime detection.
     */
    public <I, O> RequestHandler<I, O> wrap(RequestHandler<I, O> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String handlerAction = actionFor(handler);
        return (input, context) -> invoke(input, context, handlerAction, () -> handler.handleRequest(input, context));
    }

    /**
     * Wraps an {@code (event, context)} handler. The context argument drives runtime detection.
     */
    public <E, C, R, X extends Exception> InvocationHandler<E, C, R, X> wrap(InvocationHandler<E, C, R, X> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String handlerAction = actionFor(handler);
        return (event, context) -> invoke(event, context, handlerAction, () -> handler.handle(event, context));
    }

    /**
     * Runs work inside the boundary, using the configured action label.
     *
     * @param envelope the platform context object, a map, or null for auto-detection
     */
    public <T, X extends Exception> T call(Object envelope, ThrowingSupplier<T, X> work) throws X {
        return call(envelope, action != null ? action : DEFAULT_ACTION, work);
    }

    /**
     * Runs work inside the boundary.
     *
     * @param envelope the platform context object, a map, or null for auto-detection
     * @param actionName recorded as {@code extra.action} on a failure event
     * @return exactly what {@code work} returned
     * @throws X exactly what {@code work} threw
     */
    public <T, X extends Exception> T call(Object envelope, String actionName, ThrowingSupplier<T, X> work) throws X {
        return invoke(null, envelope, actionName, work);
    }

    private <T, X extends Exception> T invoke(Object input, Object envelope, String actionName,
            ThrowingSupplier<T, X> work) throws X {
        Objects.requireNonNull(work, "work must not be null");
        try (ContextScope scope = open(envelope)) {
            try {
                return work.get();
            } catch (Exception e) {
                report(e, input, envelope, actionName, scope);
                throw e;
            }
        }
    }

    private ContextScope open(Object envelope) {
        RuntimeContext detected = forcedSource != null
                ? contexts.detector().detect(envelope, forcedSource)
                : contexts.detector().detect(envelope);
        return contexts.open(workflow != null ? detected.withWorkflow(workflow) : detected);
    }

    private void report(Exception failure, Object input, Object envelope, String actionName, ContextScope scope) {
        String type = failure.getClass().getSimpleName();
        try {
            RuntimeContext context = contexts.current().orElse(scope.context());
            String detail = failure.getMessage();
            String message = detail == null ? summary + ": " + type : summary + ": " + type + ": " + detail;

            Map<String, Object> eventExtra = new LinkedHashMap<>(extra);
            eventExtra.putAll(derivedDetails(input, envelope));
            eventExtra.put("action", actionName);
            String effectiveWorkflow = workflow != null ? workflow : context.workflow();
            if (effectiveWorkflow != null) {
                eventExtra.put("workflow", effectiveWorkflow);
            }

            LogEvent event = LogEvent.builder(Severity.CRITICAL, message)
                    .messageTemplate(summary + ": " + type)
                    .timestamp(clock.instant())
                    .loggerName(LOGGER_NAME)
                    .exception(failure)
                    .extra(eventExtra)
                    .context(context)
                    .build();
            interceptor.handle(event);
        } catch (RuntimeException reportFailure) {
            log.warn("Unable to report {} from [{}]", type, actionName, reportFailure);
        }
    }

    private Map<String, Object> derivedDetails(Object input, Object envelope) {
        Map<String, Object> derived = new LinkedHashMap<>();
        if (details != null) {
            try {
                Map<String, ?> values = details.apply(input, envelope);
                if (values != null) {
                    values.forEach((k, v) -> {
                        if (k != null && v != null) {
                            derived.put(k, v);
                        }
                    });
                }
            } catch (RuntimeException e) {
                log.warn("Details callback failed for capture boundary", e);
            }
        }
        if (subjectId != null) {
            try {
                String subject = subjectId.apply(input, envelope);
                if (subject != null && !subject.isBlank()) {
                    derived.put(SUBJECT_ID, subject);
                }
            } catch (RuntimeException e) {
                log.warn("Subject id callback failed for capture boundary", e);
            }
        }
        return derived;
    }

    private String actionFor(Object handler) {
        if (action != null) {
            return action;
        }
        String name = handler.getClass().getSimpleName();
        // lambdas and anonymous classes have no useful simple name
        return name.isEmpty() || name.contains("$$Lambda") || name.contains("$Lambda") ? DEFAULT_ACTION : name;
    }

    public static final class Builder {
        private EventInterceptor interceptor;
        private RuntimeContexts contexts;
        private String workflow;
        private String summary = DEFAULT_SUMMARY;
        private String action;
        private Source forcedSource;
        private final Map<String, Object> extra = new LinkedHashMap<>();
        private BiFunction<Object, Object, ? extends Map<String, ?>> details;
        private BiFunction<Object, Object, String> subjectId;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the interceptor that receives failure events (required).
         */
        public Builder interceptor(EventInterceptor interceptor) {
            this.interceptor = Objects.requireNonNull(interceptor, "interceptor must not be null");
            return this;
        }

        /**
         * Sets the context registry used for detection and propagation (required).
         */
        public Builder contexts(RuntimeContexts contexts) {
            this.contexts = Objects.requireNonNull(contexts, "contexts must not be null");
            return this;
        }

        public Builder workflow(String workflow) {
            this.workflow = workflow;
            return this;
        }

        /**
         * Sets the human summary that prefixes failure messages (defaults to "Automation failed").
         */
        public Builder summary(String summary) {
            this.summary = Objects.requireNonNull(summary, "summary must not be null");
            return this;
        }

        /**
         * Overrides the action label (defaults to the wrapped handler's class name).
         */
        public Builder action(String action) {
            this.action = action;
            return this;
        }

        /**
         * Skips auto-detection and only consults probes for the given source.
         */
        public Builder source(Source source) {
            this.forcedSource = source;
            return this;
        }

        /**
         * Adds a static key/value to every failure event.
         */
        public Builder extra(String key, Object value) {
            this.extra.put(Objects.requireNonNull(key, "key must not be null"), Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        /**
         * Derives extra key/values from the handler's input and context argument when an
         * invocation fails. For {@link #call} the input is null.
         */
        public Builder details(BiFunction<Object, Object, ? extends Map<String, ?>> details) {
            this.details = details;
            return this;
        }

        /**
         * Derives a subject identifier (an order id, a customer id) from the handler's input and
         * context argument when an invocation fails. Recorded as {@code extra.subject_id}.
         */
        public Builder subjectId(BiFunction<Object, Object, String> subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Capture build() {
            Objects.requireNonNull(interceptor, "interceptor must be set");
            Objects.requireNonNull(contexts, "contexts must be set");
            return new Capture(this);
        }
    }
}
