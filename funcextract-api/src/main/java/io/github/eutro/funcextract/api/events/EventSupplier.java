package io.github.eutro.funcextract.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Consumer;

/**
 * Something on which events can be listened to and dispatched.
 * <p>
 * Listeners run in the order they were added. Once a {@link CancellableEvent} is cancelled,
 * the remaining listeners are skipped.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new HashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new ArrayList<>()).add(listener);
    }

    /**
     * Dispatch an event to its listeners.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        List<Consumer<T>> eventListeners = (List<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptyList());
        for (Consumer<T> consumer : eventListeners) {
            if (isCancelled(event)) break;
            consumer.accept(event);
        }
        return event;
    }

    private static boolean isCancelled(Object event) {
        return event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled();
    }
}
