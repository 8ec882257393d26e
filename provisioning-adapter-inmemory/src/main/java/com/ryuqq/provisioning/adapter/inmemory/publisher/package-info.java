/**
 * In-memory ProvisioningPublisher adapter implementation package.
 *
 * <p>Queues provisioning events for tests and local runs.</p>
 *
 * @see com.ryuqq.provisioning.core.spi.ProvisioningPublisher
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.adapter.inmemory.publisher;
