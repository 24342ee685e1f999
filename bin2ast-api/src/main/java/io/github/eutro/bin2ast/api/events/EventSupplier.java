package io.github.eutro.bin2ast.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Something on which decompilation events can be listened to and dispatched.
 * <p>
 * Listeners run in the order they were added.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, Set<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new LinkedHashSet<>()).add(listener);
    }

    /**
     * Dispatch an event to its listeners, stopping early if it is {@link CancellableEvent cancelled}.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, after every listener has seen it.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        Set<Consumer<T>> eventListeners = (Set<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptySet());
        for (Consumer<T> consumer : eventListeners) {
            if (isCancelled(event)) break;
            consumer.accept(event);
        }
        return event;
    }

    /**
     * Get whether an event was cancelled by a listener.
     *
     * @param event The event.
     * @return Whether it is a cancelled {@link CancellableEvent}.
     */
    public static boolean isCancelled(Object event) {
        return event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled();
    }
}
