package io.github.eutro.funcextract.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something on which events can be listened to.
 *
 * @param <S> The type of events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Listen to the given event type.
     * <p>
     * Listeners run only for events fired as exactly this class.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
