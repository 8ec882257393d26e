package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.AppSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for app snapshots and their append-only event log.
 *
 * <p>The core never calls this interface. An orchestration layer loads a
 * snapshot, reconstructs the typestate variant, invokes an operation and hands
 * the produced events back to {@link #appendEvents(AppId, List, long)}.</p>
 *
 * <p><strong>Optimistic Concurrency:</strong></p>
 * <pre>
 * 1. load(uuid)                          → snapshot (version = N)
 * 2. typestate operation                 → events
 * 3. appendEvents(uuid, events, N)       → Appended(N + k) | Conflict(N, M)
 * </pre>
 *
 * <p>Two callers that load the same version can both compute a valid next
 * state; only the first append wins. The loser receives
 * {@link AppendResult.Conflict} and must reload.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic append: the version check and the write happen as one step</li>
 *   <li>All-or-nothing: on conflict no event of the batch is stored</li>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>The stored snapshot must equal the fold of the stored events</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface AppStore {

    /**
     * Loads the current snapshot.
     *
     * <p>The returned snapshot is untrusted: it may violate the structural
     * invariant and must go through
     * {@link com.ryuqq.provisioning.core.typestate.AppReconstructor} before use.</p>
     *
     * @param uuid the app ID
     * @return the snapshot, or empty if the app does not exist
     * @throws IllegalArgumentException if uuid is null
     */
    Optional<AppSnapshot> load(AppId uuid);

    /**
     * Appends events if the stored version still equals {@code expectedVersion}.
     *
     * <p>{@code expectedVersion} is the version of the snapshot the caller
     * loaded, or {@code 0} when creating a new app.</p>
     *
     * @param uuid the app ID
     * @param events the events to append, oldest first (must not be empty)
     * @param expectedVersion the version the caller based its decision on
     * @return {@link AppendResult.Appended} with the new version, or
     *         {@link AppendResult.Conflict} if another writer got there first
     * @throws IllegalArgumentException if uuid or events is null, events is empty,
     *         an event belongs to another app, or expectedVersion is negative
     */
    AppendResult appendEvents(AppId uuid, List<AppDomainEvent> events, long expectedVersion);
}
