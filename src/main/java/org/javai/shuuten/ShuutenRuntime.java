package org.javai.shuuten;

import org.apache.logging.log4j.LogManager;
import org.javai.shuuten.boundary.Capture;
import org.javai.shuuten.context.ContextDetector;
import org.javai.shuuten.context.ContextToken;
import org.javai.shuuten.context.RuntimeContexts;
import org.javai.shuuten.dispatch.Destination;
import org.javai.shuuten.dispatch.EventInterceptor;
import org.javai.shuuten.dispatch.InterceptorSettings;
import org.javai.shuuten.dispatch.LocalEventSink;
import org.javai.shuuten.ops.Redactor;
import org.javai.shuuten.ops.email.EmailDestination;
import org.javai.shuuten.ops.log4j.Log4jLocalSink;
import org.javai.shuuten.ops.log4j.NotificationAppender;
import org.javai.shuuten.ops.log4j.QuietLoggers;
import org.javai.shuuten.ops.slack.SlackDestination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One fully wired notification pipeline: context registry, interceptor, destinations and
 * the Log4j2 appender.
 *
 * <p>Most applications use the {@link Shuuten} facade, which holds a single runtime per
 * process. Tests and embedders can build their own:
 *
 * <pre>{@code
 * try (ShuutenRuntime runtime = ShuutenRuntime.builder(config)
 *         .destinations(List.of(slack))
 *         .installAppender(false)
 *         .build()) {
 *     runtime.capture().build().call(null, () -> job.run());
 * }
 * }</pre>
 */
public final class ShuutenRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShuutenRuntime.class);

    private final ShuutenConfig config;
    private final RuntimeContexts contexts;
    private final EventInterceptor interceptor;
    private final List<Destination> destinations;
    private final NotificationAppender appender;
    private final Clock clock;

    private ShuutenRuntime(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.contexts = new RuntimeContexts(ContextDetector.builder()
                .app(config.app())
                .env(config.env())
                .environment(builder.environment)
                .clock(clock)
                .build());
        this.destinations = builder.destinations != null
                ? List.copyOf(builder.destinations)
                : destinationsFrom(config);
        this.interceptor = new EventInterceptor(builder.localSink, new Redactor(), clock);
        this.interceptor.configure(InterceptorSettings.of(config, destinations));

        config.quiet().ifPresent(QuietLoggers::apply);

        if (builder.installAppender) {
            this.appender = new NotificationAppender(interceptor, contexts);
            this.appender.install();
        } else {
            this.appender = null;
        }

        log.debug("Started [app={}, env={}, minLevel={}, destinations={}]",
                config.app(), config.env(), config.minLevel(),
                destinations.stream().map(d -> d.name() + (d.isEnabled() ? "" : " (disabled)")).toList());
    }

    public static Builder builder(ShuutenConfig config) {
        return new Builder(config);
    }

    /**
     * Creates the Slack and email destinations from configuration. Both are always present;
     * one whose settings are missing is disabled.
     */
    static List<Destination> destinationsFrom(ShuutenConfig config) {
        List<Destination> built = new ArrayList<>();
        built.add(SlackDestination.fromConfig(config));
        built.add(EmailDestination.fromConfig(config));
        return built;
    }

    public ShuutenConfig config() {
        return config;
    }

    public RuntimeContexts contexts() {
        return contexts;
    }

    public EventInterceptor interceptor() {
        return interceptor;
    }

    public List<Destination> destinations() {
        return destinations;
    }

    public EventLogger getLogger(String name) {
        return new EventLogger(LogManager.getLogger(name));
    }

    /**
     * Returns a capture builder already bound to this runtime's interceptor and contexts.
     */
    public Capture.Builder capture() {
        return Capture.builder()
                .interceptor(interceptor)
                .contexts(contexts)
                .clock(clock);
    }

    /**
     * Sends an event through the pipeline. An event without a context gets the current one, or a
     * freshly detected one carrying the configured app and env when none is active.
     */
    public List<DestinationResult> notify(LogEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        LogEvent withContext = event;
        if (event.contextSnapshot() == null) {
            withContext = new LogEvent(event.level(), event.message(), event.messageTemplate(), event.timestamp(),
                    event.loggerName(), event.exceptionInfo(), event.extra(), contexts.currentOrDetected());
        }
        return interceptor.handle(withContext);
    }

    /**
     * Sends an ad hoc notification.
     *
     * @param failure optional exception to attach (may be null)
     */
    public List<DestinationResult> notify(Severity level, String summary, Throwable failure) {
        return notify(LogEvent.builder(level, summary)
                .timestamp(clock.instant())
                .loggerName("shuuten.notify")
                .exception(failure)
                .build());
    }

    public ContextToken detectAndSetContext(Object envelope) {
        return contexts.detectAndSetContext(envelope);
    }

    public ContextToken detectAndSetContext(Object envelope, String workflow) {
        return contexts.detectAndSetContext(envelope, workflow);
    }

    public void reset(ContextToken token) {
        contexts.reset(token);
    }

    /**
     * Detaches the Log4j2 appender. Destinations hold no resources that need closing.
     */
    @Override
    public void close() {
        if (appender != null) {
            appender.uninstall();
        }
    }

    public static final class Builder {
        private final ShuutenConfig config;
        private List<Destination> destinations;
        private LocalEventSink localSink;
        private Environment environment = Environment.system();
        private boolean installAppender = true;
        private Clock clock = Clock.systemUTC();

        private Builder(ShuutenConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        /**
         * Replaces the destinations built from configuration.
         */
        public Builder destinations(List<Destination> destinations) {
            this.destinations = Objects.requireNonNull(destinations, "destinations must not be null");
            return this;
        }

        public Builder localSink(LocalEventSink localSink) {
            this.localSink = Objects.requireNonNull(localSink, "localSink must not be null");
            return this;
        }

        /**
         * Sets the environment used for runtime detection.
         */
        public Builder environment(Environment environment) {
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
            return this;
        }

        /**
         * Whether to attach the {@link NotificationAppender} to the root logger (default true).
         */
        public Builder installAppender(boolean installAppender) {
            this.installAppender = installAppender;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ShuutenRuntime build() {
            if (localSink == null) {
                localSink = new Log4jLocalSink();
            }
            return new ShuutenRuntime(this);
        }
    }
}
