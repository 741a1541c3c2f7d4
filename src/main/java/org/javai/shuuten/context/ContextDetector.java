package org.javai.shuuten.context;

import org.javai.shuuten.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies an invocation envelope by running a prioritised list of {@link ContextProbe}s.
 * The first probe that matches wins; when none does, the context is {@link Source#GENERIC}.
 *
 * <p>Detection never fails. A probe that throws is logged at debug and skipped.
 *
 * <p>New platforms are added by supplying another probe:</p>
 * <pre>{@code
 * ContextDetector detector = ContextDetector.builder()
 *     .app("billing")
 *     .env("prod")
 *     .probes(List.of(new LambdaProbe(), new EcsProbe(), new BatchProbe()))
 *     .build();
 * }</pre>
 */
public final class ContextDetector {

    private static final Logger log = LoggerFactory.getLogger(ContextDetector.class);

    private final String app;
    private final String env;
    private final Environment environment;
    private final List<ContextProbe> probes;
    private final Source forcedSource;
    private final Clock clock;

    private ContextDetector(Builder builder) {
        this.app = builder.app;
        this.env = builder.env;
        this.environment = builder.environment;
        this.probes = List.copyOf(builder.probes);
        this.forcedSource = builder.forcedSource;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Detects a context for the envelope.
     *
     * @param envelope the platform-supplied context object, a map, or null
     * @return a context, never null
     */
    public RuntimeContext detect(Object envelope) {
        return detect(envelope, forcedSource);
    }

    /**
     * Detects a context, only consulting probes for {@code source} when it is non-null.
     */
    public RuntimeContext detect(Object envelope, Source source) {
        if (source == Source.GENERIC) {
            return assemble(Source.GENERIC, null, Map.of());
        }
        for (ContextProbe probe : probes) {
            if (source != null && probe.source() != source) {
                continue;
            }
            try {
                Optional<ContextProbe.Detection> detection = probe.probe(envelope, environment);
                if (detection.isPresent()) {
                    return assemble(probe.source(), detection.get().invocationId(), detection.get().caller());
                }
            } catch (ContextDetectionException | RuntimeException e) {
                log.debug("Context probe {} failed; trying the next one", probe.getClass().getSimpleName(), e);
            }
        }
        return assemble(source != null ? source : Source.GENERIC, null, Map.of());
    }

    private RuntimeContext assemble(Source source, String invocationId, Map<String, String> detected) {
        Map<String, String> caller = new LinkedHashMap<>(detected);
        if (source != Source.GENERIC && !caller.containsKey(RuntimeContext.REGION)) {
            String region = sniffRegion();
            if (region != null) {
                caller.put(RuntimeContext.REGION, region);
            }
        }
        putIfPresent(caller, RuntimeContext.ACCOUNT_NAME, environment.getNonBlank("AWS_ACCOUNT_NAME"));
        putIfPresent(caller, RuntimeContext.SOURCE_CODE, environment.getNonBlank("SOURCE_CODE"));

        String region = caller.get(RuntimeContext.REGION);
        String logGroup = caller.get(RuntimeContext.LOG_GROUP);
        if (region != null && logGroup != null) {
            caller.put(RuntimeContext.LOG_URL,
                    AwsLinks.cloudWatchLogStream(region, logGroup, caller.get(RuntimeContext.LOG_STREAM)));
        }
        return new RuntimeContext(invocationId, app, env, null, source, caller, clock.instant());
    }

    private String sniffRegion() {
        String region = environment.getNonBlank("AWS_REGION");
        return region != null ? region : environment.getNonBlank("AWS_DEFAULT_REGION");
    }

    private static void putIfPresent(Map<String, String> caller, String key, String value) {
        if (value != null && !caller.containsKey(key)) {
            caller.put(key, value);
        }
    }

    public static final class Builder {
        private String app = "app";
        private String env = "dev";
        private Environment environment = Environment.system();
        private List<ContextProbe> probes = List.of(new LambdaProbe(), new EcsProbe());
        private Source forcedSource;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder app(String app) {
            this.app = Objects.requireNonNull(app, "app must not be null");
            return this;
        }

        public Builder env(String env) {
            this.env = Objects.requireNonNull(env, "env must not be null");
            return this;
        }

        public Builder environment(Environment environment) {
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
            return this;
        }

        /**
         * Replaces the probe list. Order is priority order.
         */
        public Builder probes(List<ContextProbe> probes) {
            this.probes = Objects.requireNonNull(probes, "probes must not be null");
            return this;
        }

        /**
         * Restricts detection to one source (null means detect automatically).
         */
        public Builder forcedSource(Source forcedSource) {
            this.forcedSource = forcedSource;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ContextDetector build() {
            return new ContextDetector(this);
        }
    }
}
