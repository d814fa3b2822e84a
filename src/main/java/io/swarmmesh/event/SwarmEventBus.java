package io.swarmmesh.event;

import io.swarmmesh.observability.StructuredLogger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class SwarmEventBus {
    private static final StructuredLogger LOG = StructuredLogger.of(SwarmEventBus.class);

    private final Map<SwarmEventType, List<Consumer<SwarmEvent>>> byType = new EnumMap<>(SwarmEventType.class);
    private final List<Consumer<SwarmEvent>> all = new ArrayList<>();

    public synchronized void subscribe(SwarmEventType type, Consumer<SwarmEvent> listener) {
        byType.computeIfAbsent(type, ignored -> new ArrayList<>()).add(listener);
    }

    public synchronized <T extends SwarmEvent> void subscribe(Class<T> eventClass, Consumer<T> listener) {
        all.add(event -> {
            if (eventClass.isInstance(event)) {
                listener.accept(eventClass.cast(event));
            }
        });
    }

    public synchronized void subscribeAll(Consumer<SwarmEvent> listener) {
        all.add(listener);
    }

    public void publish(SwarmEvent event) {
        List<Consumer<SwarmEvent>> targets;
        synchronized (this) {
            targets = new ArrayList<>(byType.getOrDefault(event.type(), List.of()));
            targets.addAll(all);
        }
        for (Consumer<SwarmEvent> listener : targets) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOG.error("Event listener failed", StructuredLogger.fields(
                        "event", event.type().wire(),
                        "nodeId", event.nodeId()
                ), e);
            }
        }
    }
}
