package com.wavesmith.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for executor and coordinator events.
 * <p>
 * Subscribers register either for one goal hash or for a set of {@link EventType}s.
 * Delivery happens on the publishing thread, which is usually a worker or an
 * executor thread, so subscribers must be quick and thread-safe. A subscriber
 * that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-goal subscribers keyed by goal hash. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<WavesmithEvent>>> goalSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<TypedSubscriber> typedSubscribers = new CopyOnWriteArrayList<>();

    public void publish(WavesmithEvent event) {
        log.debug("Publishing {} for goal {}", event.eventType(), event.goalHash());

        if (event.goalHash() != null) {
            List<Consumer<WavesmithEvent>> subs = goalSubscribers.get(event.goalHash());
            if (subs != null) {
                for (Consumer<WavesmithEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (TypedSubscriber subscriber : typedSubscribers) {
            if (subscriber.types().contains(event.type())) {
                deliverSafely(subscriber.consumer(), event);
            }
        }
    }

    /**
     * Subscribe to the execution events of one goal.
     *
     * @param goalHash the goal to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String goalHash, Consumer<WavesmithEvent> consumer) {
        goalSubscribers.computeIfAbsent(goalHash, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to goal {}", goalHash);
        return () -> {
            CopyOnWriteArrayList<Consumer<WavesmithEvent>> subs = goalSubscribers.get(goalHash);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to the given event types across all goals.
     *
     * @param types    event types to receive; must not be empty
     * @param consumer callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Set<EventType> types, Consumer<WavesmithEvent> consumer) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        var subscriber = new TypedSubscriber(EnumSet.copyOf(types), consumer);
        typedSubscribers.add(subscriber);
        log.debug("Subscribed to {}", types);
        return () -> typedSubscribers.remove(subscriber);
    }

    public Subscription subscribeAll(Consumer<WavesmithEvent> consumer) {
        return subscribe(EnumSet.allOf(EventType.class), consumer);
    }

    /** Subscribe to every event of one {@link EventType.Scope}. */
    public Subscription subscribe(EventType.Scope scope, Consumer<WavesmithEvent> consumer) {
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        for (EventType type : EventType.values()) {
            if (type.scope() == scope) {
                types.add(type);
            }
        }
        return subscribe(types, consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record TypedSubscriber(Set<EventType> types, Consumer<WavesmithEvent> consumer) {
        // identity equality: each registration unsubscribes on its own
        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }

    private void deliverSafely(Consumer<WavesmithEvent> subscriber, WavesmithEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
