package io.github.sigwasm.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Listeners for the events of a compiler or of one compilation, keyed by exact event class.
 * <p>
 * Listeners run in the order they were added.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new HashMap<>();

    /**
     * Listen to the given event type.
     * <p>
     * Only events dispatched as exactly {@code eventClass} reach the listener.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, k -> new ArrayList<>()).add(listener);
    }

    /**
     * Dispatch an event to every listener.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        return dispatchUntil(eventClass, event, evt -> false);
    }

    /**
     * Dispatch an event to listeners, stopping before the next listener once {@code stop} holds.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param stop       Checked before each listener.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatchUntil(Class<T> eventClass, T event, Predicate<? super T> stop) {
        @SuppressWarnings("unchecked")
        List<Consumer<T>> eventListeners = (List<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptyList());
        for (Consumer<T> consumer : new ArrayList<>(eventListeners)) {
            if (stop.test(event)) break;
            consumer.accept(event);
        }
        return event;
    }
}
