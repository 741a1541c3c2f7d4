package org.javai.shuuten.dispatch;

import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.LogEvent;

/**
 * An external notification sink.
 *
 * <p>Implementations must not throw from {@link #send}: every failure, including exhausted
 * retries, is reported as a failed {@link DestinationResult}. A destination whose required
 * settings are missing reports itself disabled and is never attempted.
 */
public interface Destination {

    /**
     * A short name used in results and diagnostics (e.g. {@code slack}).
     */
    String name();

    /**
     * Returns false when required configuration is missing.
     */
    boolean isEnabled();

    /**
     * Explains why the destination is disabled, or null when it is enabled.
     */
    default String disabledReason() {
        return isEnabled() ? null : "not configured";
    }

    /**
     * Delivers one event, synchronously and within a bounded time.
     */
    DestinationResult send(LogEvent event);
}
