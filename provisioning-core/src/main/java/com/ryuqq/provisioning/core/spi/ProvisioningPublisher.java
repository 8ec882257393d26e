package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.event.AppDomainEvent;

/**
 * Provisioning collaborator SPI.
 *
 * <p>Receives {@code ExistingInfrastructureSelected} and {@code BuildRequested}
 * events after they have been appended, and performs the cloud-side work
 * asynchronously. From the caller's perspective this is fire-and-forget: no
 * completion is awaited and no "provisioning in progress" status exists.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Non-blocking: hand the event off and return</li>
 *   <li>Thread-safe: may be called from multiple threads</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface ProvisioningPublisher {

    /**
     * Publishes one provisioning event.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null or not a provisioning signal
     * @throws RuntimeException if the underlying transport fails
     */
    void publish(AppDomainEvent event);
}
