package com.skybrief.core.bus;

import com.skybrief.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> subscribers = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    // Subscribing to a supertype (Event.class included) receives every matching subtype.
    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        Consumer<? super Event> adapter = event -> handler.accept(type.cast(event));
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(adapter);
    }

    public void publish(Event event) {
        for (Map.Entry<Class<? extends Event>, List<Consumer<? super Event>>> entry : subscribers.entrySet()) {
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (Consumer<? super Event> handler : entry.getValue()) {
                try {
                    handler.accept(event);
                } catch (Exception ex) {
                    onHandlerError.accept(event, ex);
                }
            }
        }
    }
}
