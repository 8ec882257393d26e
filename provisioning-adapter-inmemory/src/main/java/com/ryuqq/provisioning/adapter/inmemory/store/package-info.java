/**
 * In-memory AppStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.provisioning.core.spi.AppStore} SPI for testing and
 * educational purposes.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Event sourcing:</strong> The row is the fold of the log</li>
 *   <li><strong>Optimistic concurrency:</strong> Version compare-and-swap on append</li>
 *   <li><strong>Persisted layout:</strong> Rows use the flat {@link com.ryuqq.provisioning.core.model.PersistedAppState} shape</li>
 * </ul>
 *
 * @see com.ryuqq.provisioning.core.spi.AppStore
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.adapter.inmemory.store;
