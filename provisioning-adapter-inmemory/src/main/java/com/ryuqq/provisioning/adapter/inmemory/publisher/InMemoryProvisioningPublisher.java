package com.ryuqq.provisioning.adapter.inmemory.publisher;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.spi.ProvisioningPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link ProvisioningPublisher} SPI.
 *
 * <p>Published events are queued in arrival order. A test or a local
 * provisioning stub takes them with {@link #drain()}.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentLinkedQueue} backs the queue; publish never blocks</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryProvisioningPublisher implements ProvisioningPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProvisioningPublisher.class);

    private final ConcurrentLinkedQueue<AppDomainEvent> queue;

    /**
     * Creates a new publisher with an empty queue.
     */
    public InMemoryProvisioningPublisher() {
        this.queue = new ConcurrentLinkedQueue<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Rejects events that are not provisioning signals.</p>
     */
    @Override
    public void publish(AppDomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!event.type().isProvisioningSignal()) {
            throw new IllegalArgumentException("Not a provisioning event: " + event.type());
        }
        queue.offer(event);
        log.debug("Queued {} for {}", event.type(), event.uuid());
    }

    /**
     * Removes and returns all queued events, oldest first.
     *
     * @return the drained events (may be empty)
     */
    public List<AppDomainEvent> drain() {
        List<AppDomainEvent> drained = new ArrayList<>();
        AppDomainEvent event;
        while ((event = queue.poll()) != null) {
            drained.add(event);
        }
        return drained;
    }

    /**
     * Returns the queued events without removing them.
     *
     * @return snapshot of the queue, oldest first
     */
    public List<AppDomainEvent> published() {
        return List.copyOf(queue);
    }

    /**
     * Clears the queue.
     */
    public void clear() {
        queue.clear();
    }
}
