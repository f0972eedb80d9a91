package com.nginx.log.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide publish/subscribe hub for indexing events. Listeners are invoked
 * synchronously on the publishing thread, in subscription order.
 */
public class EventBus {

    static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public Subscription subscribe(EventListener listener) {
        return subscribe(null, listener);
    }

    /**
     * @param type only events of this type are delivered; null for all events
     */
    public Subscription subscribe(EventType type, EventListener listener) {
        Subscription subscription = new Subscription(type, listener);
        subscriptions.add(subscription);
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        subscriptions.remove(subscription);
    }

    public void publish(EventType type, Object data) {
        publish(new LogIndexEvent(type, data));
    }

    public void publish(LogIndexEvent event) {
        for (Subscription subscription : subscriptions) {
            if (subscription.type != null && subscription.type != event.getType()) {
                continue;
            }
            try {
                subscription.listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Event listener failed on {}: {}", event.getType(), e.getMessage(), e);
            }
        }
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    public final class Subscription implements AutoCloseable {

        private final EventType type;
        private final EventListener listener;

        private Subscription(EventType type, EventListener listener) {
            this.type = type;
            this.listener = listener;
        }

        @Override
        public void close() {
            unsubscribe(this);
        }
    }
}
