package org.javai.shuuten.dispatch;

import org.javai.shuuten.LogEvent;

/**
 * Writes the local copy of an event (typically to stdout, where the host's log collector
 * picks it up).
 */
@FunctionalInterface
public interface LocalEventSink {

    /**
     * @param event the (redacted) event
     * @param dispatched false if the event was suppressed as a duplicate
     */
    void emit(LogEvent event, boolean dispatched);

    static LocalEventSink noOp() {
        return (event, dispatched) -> {};
    }
}
