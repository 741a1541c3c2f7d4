package org.javai.shuuten.dispatch;

import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.LogEvent;
import org.javai.shuuten.ops.Redactor;
import org.javai.shuuten.dedup.DedupCache;
import org.javai.shuuten.dedup.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The single entry point every candidate notification passes through.
 *
 * <p>For each event, {@link #handle} applies the severity threshold, consults the
 * {@link DedupCache}, writes the local copy and fans the event out to every configured
 * {@link Destination}. Each destination is isolated: one that fails or throws never prevents
 * the others from being attempted, and nothing escapes {@code handle}.
 *
 * <p>Sends run synchronously on the caller's thread. The dedup entry is written before any
 * destination is attempted.
 *
 * <pre>{@code
 * EventInterceptor interceptor = new EventInterceptor(new Log4jLocalSink("billing"));
 * interceptor.configure(new InterceptorSettings(Severity.ERROR,
 *         List.of(slack, email), Duration.ofSeconds(30), true));
 *
 * interceptor.handle(event);
 * }</pre>
 */
public final class EventInterceptor {

    private static final Logger log = LoggerFactory.getLogger(EventInterceptor.class);

    private final LocalEventSink localSink;
    private final Redactor redactor;
    private final Clock clock;
    private volatile State state;

    public EventInterceptor(LocalEventSink localSink) {
        this(localSink, new Redactor(), Clock.systemUTC());
    }

    public EventInterceptor(LocalEventSink localSink, Redactor redactor, Clock clock) {
        this.localSink = Objects.requireNonNull(localSink, "localSink must not be null");
        this.redactor = Objects.requireNonNull(redactor, "redactor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.state = new State(InterceptorSettings.defaults(),
                new DedupCache(InterceptorSettings.defaults().dedupWindow(), clock));
    }

    /**
     * Applies new settings. The dedup history survives reconfiguration unless the window changes.
     */
    public void configure(InterceptorSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        synchronized (this) {
            DedupCache cache = state.cache;
            if (!cache.window().equals(settings.dedupWindow())) {
                cache = new DedupCache(settings.dedupWindow(), clock);
            }
            state = new State(settings, cache);
        }
        log.debug("Interceptor configured: minLevel={}, destinations={}, dedupWindow={}, localCopy={}",
                settings.minLevel(), settings.destinations().size(), settings.dedupWindow(), settings.emitLocalCopy());
    }

    public InterceptorSettings settings() {
        return state.settings;
    }

    public DedupCache dedupCache() {
        return state.cache;
    }

    /**
     * Filters, deduplicates and dispatches one event. Never throws.
     *
     * @return one result per configured destination, or an empty list if the event was below
     *         the threshold or suppressed as a duplicate
     */
    public List<DestinationResult> handle(LogEvent event) {
        if (event == null) {
            return List.of();
        }
        State current = state;
        InterceptorSettings settings = current.settings;
        if (!event.level().isAtLeast(settings.minLevel())) {
            return List.of();
        }

        try {
            LogEvent safe = redactor.redact(event);
            boolean dispatch = current.cache.tryAcquire(Fingerprint.of(event));

            if (settings.emitLocalCopy()) {
                emitLocal(safe, dispatch);
            }
            if (!dispatch) {
                log.debug("Suppressed duplicate event from [{}] within {}", event.loggerName(), settings.dedupWindow());
                return List.of();
            }
            return dispatch(safe, settings.destinations());
        } catch (RuntimeException e) {
            log.warn("Event interception failed for [{}]", event.loggerName(), e);
            return List.of();
        }
    }

    private void emitLocal(LogEvent event, boolean dispatched) {
        try {
            localSink.emit(event, dispatched);
        } catch (RuntimeException e) {
            log.warn("Local event sink failed", e);
        }
    }

    private List<DestinationResult> dispatch(LogEvent event, List<Destination> destinations) {
        List<DestinationResult> results = new ArrayList<>(destinations.size());
        for (Destination destination : destinations) {
            DestinationResult result = sendTo(destination, event);
            results.add(result);
            logResult(result);
        }
        return results;
    }

    private static DestinationResult sendTo(Destination destination, LogEvent event) {
        String name = safeName(destination);
        try {
            if (!destination.isEnabled()) {
                return DestinationResult.disabled(name, destination.disabledReason());
            }
            DestinationResult result = destination.send(event);
            return result != null ? result : DestinationResult.failed(name, "destination returned no result", 1);
        } catch (RuntimeException e) {
            return DestinationResult.failed(name, e.getClass().getSimpleName() + ": " + e.getMessage(), 1);
        }
    }

    private static String safeName(Destination destination) {
        try {
            String name = destination.name();
            return name != null ? name : destination.getClass().getSimpleName();
        } catch (RuntimeException e) {
            return destination.getClass().getSimpleName();
        }
    }

    private static void logResult(DestinationResult result) {
        switch (result.status()) {
            case DELIVERED -> log.debug("Delivered to {} after {} attempt(s)", result.destinationName(), result.attempts());
            case DISABLED -> log.debug("Skipped disabled destination {}: {}", result.destinationName(), result.error());
            case FAILED -> log.warn("Delivery to {} failed after {} attempt(s): {}",
                    result.destinationName(), result.attempts(), result.error());
        }
    }

    private record State(InterceptorSettings settings, DedupCache cache) {}
}
