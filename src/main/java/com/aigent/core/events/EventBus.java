package com.aigent.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub bus for orchestration events.
 * <p>
 * Every subscription carries a filter; an event is delivered to each subscription whose
 * filter accepts it, in subscription order, on the publishing thread. A subscriber that
 * throws is logged and skipped and never affects the publisher or later subscribers.
 * Agent lifecycle events carry no workflow id and therefore never reach workflow-scoped
 * subscriptions.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Registration(Predicate<OrchestrationEvent> filter, Consumer<OrchestrationEvent> consumer) {}

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(OrchestrationEvent event) {
        Objects.requireNonNull(event, "event");
        log.debug("Publishing {} for workflow {}", event.eventType(), event.workflowId());
        for (Registration registration : registrations) {
            deliverSafely(registration, event);
        }
    }

    /**
     * Receives only the events of one workflow execution.
     */
    public Subscription subscribe(String workflowId, Consumer<OrchestrationEvent> consumer) {
        Objects.requireNonNull(workflowId, "workflowId");
        return subscribe(event -> workflowId.equals(event.workflowId()), consumer);
    }

    /**
     * Receives events of the given types, from every workflow and from the agent registry.
     */
    public Subscription subscribeTypes(Set<String> eventTypes, Consumer<OrchestrationEvent> consumer) {
        Set<String> types = Set.copyOf(eventTypes);
        return subscribe(event -> types.contains(event.eventType()), consumer);
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    public Subscription subscribe(Predicate<OrchestrationEvent> filter, Consumer<OrchestrationEvent> consumer) {
        var registration = new Registration(Objects.requireNonNull(filter, "filter"),
                Objects.requireNonNull(consumer, "consumer"));
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Handle for cancelling a subscription. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Registration registration, OrchestrationEvent event) {
        try {
            if (registration.filter().test(event)) {
                registration.consumer().accept(event);
            }
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for workflow {}: {}",
                    event.eventType(), event.workflowId(), e.getMessage(), e);
        }
    }
}
