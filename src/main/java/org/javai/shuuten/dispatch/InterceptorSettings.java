package org.javai.shuuten.dispatch;

import org.javai.shuuten.Severity;
import org.javai.shuuten.ShuutenConfig;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings applied to an {@link EventInterceptor}.
 *
 * @param minLevel Events below this severity are ignored entirely
 * @param destinations Destinations every dispatched event is fanned out to
 * @param dedupWindow Suppression window for repeated fingerprints; zero disables deduplication
 * @param emitLocalCopy Whether events at or above {@code minLevel} are also written locally
 */
public record InterceptorSettings(
        Severity minLevel,
        List<Destination> destinations,
        Duration dedupWindow,
        boolean emitLocalCopy
) {

    public InterceptorSettings {
        Objects.requireNonNull(minLevel, "minLevel must not be null");
        Objects.requireNonNull(dedupWindow, "dedupWindow must not be null");
        if (dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must not be negative");
        }
        destinations = destinations == null ? List.of() : List.copyOf(destinations);
    }

    /**
     * ERROR and above, no destinations, a 30 second window, local copy on.
     */
    public static InterceptorSettings defaults() {
        return new InterceptorSettings(ShuutenConfig.DEFAULT_MIN_LEVEL, List.of(),
                ShuutenConfig.DEFAULT_DEDUP_WINDOW, true);
    }

    public static InterceptorSettings of(ShuutenConfig config, List<Destination> destinations) {
        return new InterceptorSettings(config.minLevel(), destinations, config.dedupWindow(), config.emitLocalLog());
    }

    public InterceptorSettings withDestinations(List<Destination> destinations) {
        return new InterceptorSettings(minLevel, destinations, dedupWindow, emitLocalCopy);
    }
}
