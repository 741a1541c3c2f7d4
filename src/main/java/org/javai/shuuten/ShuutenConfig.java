package org.javai.shuuten;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Resolved configuration for the notification pipeline.
 *
 * <p>Each option is resolved from, in order of precedence:
 * <ol>
 *   <li>an explicit value set on the {@link Builder}</li>
 *   <li>a JVM system property (e.g. {@code shuuten.slack.webhook.url})</li>
 *   <li>an environment variable (e.g. {@code SHUUTEN_SLACK_WEBHOOK_URL})</li>
 *   <li>the built-in default</li>
 * </ol>
 *
 * <p>Unparseable values fall back to the default with a warning. Missing destination
 * settings simply leave that destination disabled.
 *
 * @param app Application label attached to notifications
 * @param env Environment label (e.g. {@code prod})
 * @param minLevel Minimum severity dispatched to destinations
 * @param emitLocalLog Whether every dispatched-or-suppressed event is also written to the local log
 * @param dedupWindow Suppression window for repeated events; zero disables deduplication
 * @param quietLevel Level applied to noisy third-party loggers (may be null)
 * @param slackWebhookUrl Slack incoming webhook URL (may be null)
 * @param slackFormat Slack payload layout
 * @param sesFrom Verified SES sender address (may be null)
 * @param sesTo Recipient addresses
 * @param sesReplyTo Reply-to addresses
 * @param sesRegion SES region override (may be null)
 */
public record ShuutenConfig(
        String app,
        String env,
        Severity minLevel,
        boolean emitLocalLog,
        Duration dedupWindow,
        Severity quietLevel,
        String slackWebhookUrl,
        SlackFormat slackFormat,
        String sesFrom,
        List<String> sesTo,
        List<String> sesReplyTo,
        String sesRegion
) {

    public static final String DEFAULT_APP = "app";
    public static final String DEFAULT_ENV = "dev";
    public static final Severity DEFAULT_MIN_LEVEL = Severity.ERROR;
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(ShuutenConfig.class);

    public ShuutenConfig {
        Objects.requireNonNull(app, "app must not be null");
        Objects.requireNonNull(env, "env must not be null");
        Objects.requireNonNull(minLevel, "minLevel must not be null");
        Objects.requireNonNull(dedupWindow, "dedupWindow must not be null");
        Objects.requireNonNull(slackFormat, "slackFormat must not be null");
        if (dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must not be negative");
        }
        sesTo = sesTo == null ? List.of() : List.copyOf(sesTo);
        sesReplyTo = sesReplyTo == null ? List.of() : List.copyOf(sesReplyTo);
    }

    /**
     * Resolves every option from system properties and the process environment.
     */
    public static ShuutenConfig fromEnvironment() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean slackConfigured() {
        return slackWebhookUrl != null && !slackWebhookUrl.isBlank();
    }

    public boolean emailConfigured() {
        return sesFrom != null && !sesFrom.isBlank() && !sesTo.isEmpty();
    }

    public Optional<Severity> quiet() {
        return Optional.ofNullable(quietLevel);
    }

    /**
     * Splits a comma-separated address list, dropping blanks.
     */
    public static List<String> splitAddresses(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public static final class Builder {
        private String app;
        private String env;
        private Severity minLevel;
        private Boolean emitLocalLog;
        private Duration dedupWindow;
        private Severity quietLevel;
        private String slackWebhookUrl;
        private SlackFormat slackFormat;
        private String sesFrom;
        private List<String> sesTo;
        private List<String> sesReplyTo;
        private String sesRegion;
        private Environment environment = Environment.system();
        private Function<String, String> systemProperties = System::getProperty;

        private Builder() {}

        public Builder app(String app) {
            this.app = app;
            return this;
        }

        public Builder env(String env) {
            this.env = env;
            return this;
        }

        public Builder minLevel(Severity minLevel) {
            this.minLevel = minLevel;
            return this;
        }

        public Builder emitLocalLog(boolean emitLocalLog) {
            this.emitLocalLog = emitLocalLog;
            return this;
        }

        public Builder dedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
            return this;
        }

        public Builder quietLevel(Severity quietLevel) {
            this.quietLevel = quietLevel;
            return this;
        }

        public Builder slackWebhookUrl(String slackWebhookUrl) {
            this.slackWebhookUrl = slackWebhookUrl;
            return this;
        }

        public Builder slackFormat(SlackFormat slackFormat) {
            this.slackFormat = slackFormat;
            return this;
        }

        public Builder sesFrom(String sesFrom) {
            this.sesFrom = sesFrom;
            return this;
        }

        public Builder sesTo(List<String> sesTo) {
            this.sesTo = sesTo;
            return this;
        }

        public Builder sesReplyTo(List<String> sesReplyTo) {
            this.sesReplyTo = sesReplyTo;
            return this;
        }

        public Builder sesRegion(String sesRegion) {
            this.sesRegion = sesRegion;
            return this;
        }

        /**
         * Overrides the environment-variable source (package-visible use is mainly for tests).
         */
        public Builder environment(Environment environment) {
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
            return this;
        }

        /**
         * Overrides the system-property source.
         */
        public Builder systemProperties(Properties properties) {
            Objects.requireNonNull(properties, "properties must not be null");
            this.systemProperties = properties::getProperty;
            return this;
        }

        public ShuutenConfig build() {
            return new ShuutenConfig(
                    firstNonNull(app, lookup("shuuten.app", "SHUUTEN_APP"), DEFAULT_APP),
                    firstNonNull(env, lookup("shuuten.env", "SHUUTEN_ENV"), DEFAULT_ENV),
                    minLevel != null ? minLevel : resolveSeverity("shuuten.min.level", "SHUUTEN_MIN_LEVEL", DEFAULT_MIN_LEVEL),
                    emitLocalLog != null ? emitLocalLog : resolveBoolean("shuuten.emit.local.log", "SHUUTEN_EMIT_LOCAL_LOG", true),
                    dedupWindow != null ? dedupWindow : resolveWindow(),
                    quietLevel != null ? quietLevel : resolveSeverity("shuuten.quiet.level", "SHUUTEN_QUIET_LEVEL", null),
                    slackWebhookUrl != null ? slackWebhookUrl : lookup("shuuten.slack.webhook.url", "SHUUTEN_SLACK_WEBHOOK_URL"),
                    slackFormat != null ? slackFormat : resolveSlackFormat(),
                    sesFrom != null ? sesFrom : lookup("shuuten.ses.from", "SHUUTEN_SES_FROM"),
                    sesTo != null ? sesTo : splitAddresses(lookup("shuuten.ses.to", "SHUUTEN_SES_TO")),
                    sesReplyTo != null ? sesReplyTo : splitAddresses(lookup("shuuten.ses.reply.to", "SHUUTEN_SES_REPLY_TO")),
                    sesRegion != null ? sesRegion : lookup("shuuten.ses.region", "SHUUTEN_SES_REGION")
            );
        }

        private String lookup(String sysProp, String envVar) {
            String value = systemProperties.apply(sysProp);
            if (value == null || value.isBlank()) {
                value = environment.get(envVar);
            }
            return value == null || value.isBlank() ? null : value.trim();
        }

        private Severity resolveSeverity(String sysProp, String envVar, Severity fallback) {
            String raw = lookup(sysProp, envVar);
            if (raw == null) {
                return fallback;
            }
            Optional<Severity> parsed = Severity.parse(raw);
            if (parsed.isEmpty()) {
                log.warn("Ignoring unrecognised level '{}' for {}; using {}", raw, envVar, fallback);
            }
            return parsed.orElse(fallback);
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean fallback) {
            String raw = lookup(sysProp, envVar);
            if (raw == null) {
                return fallback;
            }
            switch (raw.toLowerCase(Locale.ROOT)) {
                case "1", "true", "yes", "on":
                    return true;
                case "0", "false", "no", "off":
                    return false;
                default:
                    log.warn("Ignoring unrecognised flag '{}' for {}; using {}", raw, envVar, fallback);
                    return fallback;
            }
        }

        private Duration resolveWindow() {
            String raw = lookup("shuuten.dedupe.window", "SHUUTEN_DEDUPE_WINDOW_S");
            if (raw == null) {
                return DEFAULT_DEDUP_WINDOW;
            }
            try {
                double seconds = Double.parseDouble(raw);
                if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                    throw new NumberFormatException("out of range");
                }
                return Duration.ofMillis(Math.round(seconds * 1000));
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid dedup window '{}'; using {}s", raw, DEFAULT_DEDUP_WINDOW.toSeconds());
                return DEFAULT_DEDUP_WINDOW;
            }
        }

        private SlackFormat resolveSlackFormat() {
            String raw = lookup("shuuten.slack.format", "SHUUTEN_SLACK_FORMAT");
            if (raw == null) {
                return SlackFormat.BLOCKS;
            }
            Optional<SlackFormat> parsed = SlackFormat.parse(raw);
            if (parsed.isEmpty()) {
                log.warn("Ignoring unrecognised Slack format '{}'; using blocks", raw);
            }
            return parsed.orElse(SlackFormat.BLOCKS);
        }

        private static String firstNonNull(String explicit, String resolved, String fallback) {
            if (explicit != null) {
                return explicit;
            }
            return resolved != null ? resolved : fallback;
        }
    }
}
