package io.github.eutro.scriptlift.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that events can be listened to on.
 *
 * @param <S> The supertype of all events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Listen to events of an exact class.
     *
     * @param eventClass The class of the event.
     * @param listener   The listener.
     * @param <T>        The type of the event.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
