package com.forewarned.core.bus;

import com.forewarned.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe keyed by concrete event class. Handlers run on the
 * publishing thread; a throwing handler is reported to the error callback and does not stop
 * delivery to the remaining handlers.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? extends Event>>> handlersByType =
            new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler failed for " + event.type() + " event", ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        handlersByType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void publish(Event event) {
        List<Consumer<? extends Event>> handlers = handlersByType.get(event.getClass());
        if (handlers == null) {
            return;
        }
        for (Consumer<? extends Event> handler : handlers) {
            deliver(handler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void deliver(Consumer<? extends Event> rawHandler, Event event) {
        try {
            ((Consumer<T>) rawHandler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
