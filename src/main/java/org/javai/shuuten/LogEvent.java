package org.javai.shuuten;

import org.javai.shuuten.context.RuntimeContext;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One candidate notification.
 *
 * @param level The event severity
 * @param message The fully rendered message
 * @param messageTemplate The message before argument interpolation (used for deduplication)
 * @param timestamp When the event was emitted
 * @param loggerName The logger that emitted the event
 * @param exceptionInfo Exception details (may be null)
 * @param extra Caller-attached key/value pairs, in insertion order
 * @param contextSnapshot The runtime context active at emission time (may be null)
 */
public record LogEvent(
        Severity level,
        String message,
        String messageTemplate,
        Instant timestamp,
        String loggerName,
        ExceptionInfo exceptionInfo,
        Map<String, Object> extra,
        RuntimeContext contextSnapshot
) {

    public LogEvent {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        message = message == null ? "" : message;
        messageTemplate = messageTemplate == null ? message : messageTemplate;
        loggerName = loggerName == null ? "" : loggerName;
        extra = extra == null || extra.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static Builder builder(Severity level, String message) {
        return new Builder(level, message);
    }

    public boolean hasException() {
        return exceptionInfo != null;
    }

    public Optional<ExceptionInfo> exception() {
        return Optional.ofNullable(exceptionInfo);
    }

    public Optional<RuntimeContext> context() {
        return Optional.ofNullable(contextSnapshot);
    }

    /**
     * Returns a copy with the given extra map, keeping everything else.
     */
    public LogEvent withExtra(Map<String, Object> extra) {
        return new LogEvent(level, message, messageTemplate, timestamp, loggerName,
                exceptionInfo, extra, contextSnapshot);
    }

    public static class Builder {
        private final Severity level;
        private final String message;
        private String messageTemplate;
        private Instant timestamp = Instant.now();
        private String loggerName;
        private ExceptionInfo exceptionInfo;
        private final Map<String, Object> extra = new LinkedHashMap<>();
        private RuntimeContext contextSnapshot;

        private Builder(Severity level, String message) {
            this.level = Objects.requireNonNull(level);
            this.message = message;
        }

        public Builder messageTemplate(String messageTemplate) {
            this.messageTemplate = messageTemplate;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder loggerName(String loggerName) {
            this.loggerName = loggerName;
            return this;
        }

        public Builder exception(Throwable throwable) {
            this.exceptionInfo = throwable == null ? null : ExceptionInfo.fromThrowable(throwable);
            return this;
        }

        public Builder exceptionInfo(ExceptionInfo exceptionInfo) {
            this.exceptionInfo = exceptionInfo;
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public Builder extra(Map<String, ?> extra) {
            if (extra != null) {
                this.extra.putAll(extra);
            }
            return this;
        }

        public Builder context(RuntimeContext contextSnapshot) {
            this.contextSnapshot = contextSnapshot;
            return this;
        }

        public LogEvent build() {
            return new LogEvent(level, message, messageTemplate, timestamp, loggerName,
                    exceptionInfo, extra, contextSnapshot);
        }
    }
}
