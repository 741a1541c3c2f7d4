package org.javai.shuuten;

import org.apache.logging.log4j.Logger;
import org.javai.shuuten.ops.log4j.EventMessage;

import java.util.Map;
import java.util.Objects;

/**
 * A named logger whose events can reach the notification pipeline.
 *
 * <p>Messages use <code>{}</code> placeholders. A trailing {@link Throwable} argument that no
 * placeholder consumes becomes the event's exception, as with Log4j and SLF4J. The
 * unformatted template is what deduplication keys on, so events that differ only in their
 * arguments are treated as repeats.
 *
 * <pre>{@code
 * EventLogger log = Shuuten.getLogger("billing.invoices");
 * log.error("Invoice {} could not be rendered", invoiceId, e);
 * log.event(Severity.WARNING, Map.of("customer", customerId), "Retrying charge {}", chargeId);
 * }</pre>
 */
public final class EventLogger {

    private final Logger logger;

    EventLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    public String name() {
        return logger.getName();
    }

    public void debug(String message, Object... args) {
        event(Severity.DEBUG, Map.of(), message, args);
    }

    public void info(String message, Object... args) {
        event(Severity.INFO, Map.of(), message, args);
    }

    public void warning(String message, Object... args) {
        event(Severity.WARNING, Map.of(), message, args);
    }

    public void error(String message, Object... args) {
        event(Severity.ERROR, Map.of(), message, args);
    }

    public void critical(String message, Object... args) {
        event(Severity.CRITICAL, Map.of(), message, args);
    }

    /**
     * Logs at ERROR with an explicit exception.
     */
    public void exception(String message, Throwable t, Object... args) {
        if (logger.isEnabled(Severity.ERROR.toLog4j())) {
            logger.log(Severity.ERROR.toLog4j(), new EventMessage(message, args, Map.of()), t);
        }
    }

    /**
     * Logs at any level with structured extras attached to the event.
     */
    public void event(Severity level, Map<String, ?> extra, String message, Object... args) {
        Objects.requireNonNull(level, "level must not be null");
        if (logger.isEnabled(level.toLog4j())) {
            logger.log(level.toLog4j(), new EventMessage(message, args, extra));
        }
    }
}
