package org.javai.shuuten.dispatch;

import org.javai.shuuten.DestinationResult;
import org.javai.shuuten.LogEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * A destination that records what it is sent and answers with a scripted result.
 */
public class RecordingDestination implements Destination {

    private final String name;
    private final boolean enabled;
    private final Function<LogEvent, DestinationResult> behaviour;
    private final List<LogEvent> received = Collections.synchronizedList(new ArrayList<>());

    private RecordingDestination(String name, boolean enabled, Function<LogEvent, DestinationResult> behaviour) {
        this.name = name;
        this.enabled = enabled;
        this.behaviour = behaviour;
    }

    public static RecordingDestination delivering(String name) {
        return new RecordingDestination(name, true, event -> DestinationResult.delivered(name, 1));
    }

    public static RecordingDestination throwing(String name, RuntimeException failure) {
        return new RecordingDestination(name, true, event -> {
            throw failure;
        });
    }

    public static RecordingDestination disabled(String name) {
        return new RecordingDestination(name, false, event -> DestinationResult.delivered(name, 1));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public DestinationResult send(LogEvent event) {
        received.add(event);
        return behaviour.apply(event);
    }

    public List<LogEvent> received() {
        return List.copyOf(received);
    }
}
