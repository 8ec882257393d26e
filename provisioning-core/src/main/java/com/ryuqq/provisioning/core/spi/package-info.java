/**
 * Service Provider Interfaces consumed around the core.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.spi.AppStore} - Snapshot load and versioned event append</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.ProvisioningPublisher} - Fire-and-forget provisioning signals</li>
 * </ul>
 *
 * <p>Reference implementations live in {@code provisioning-adapter-inmemory};
 * {@code provisioning-testkit} provides contract tests for new implementations.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.spi;
