package com.ryuqq.provisioning.adapter.inmemory.store;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.PersistedAppState;
import com.ryuqq.provisioning.core.model.PersistedAppStates;
import com.ryuqq.provisioning.core.reducer.AppReducer;
import com.ryuqq.provisioning.core.spi.AppStore;
import com.ryuqq.provisioning.core.spi.AppendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link AppStore} SPI for testing and reference purposes.
 *
 * <p>Each app is kept as a flat {@link PersistedAppState} row next to its
 * append-only event log. Appended events are folded through {@link AppReducer}
 * so the stored row always equals the fold of the stored log.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>rows:</strong> ConcurrentHashMap&lt;AppId, PersistedAppState&gt; - Current persisted row (O(1) access)</li>
 *   <li><strong>eventLogs:</strong> ConcurrentHashMap&lt;AppId, List&lt;AppDomainEvent&gt;&gt; - Append-only history per app</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>{@link #appendEvents} is synchronized: version check, fold and write happen as one step</li>
 *   <li>{@link #load} reads without locking; rows are immutable and replaced atomically</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No durability: data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AppStore store = new InMemoryAppStore();
 * NewApp app = App.create(AppId.of("u1"));
 *
 * // 1. 신규 App 저장 (expectedVersion = 0)
 * store.appendEvents(app.uuid(), app.events(), 0);
 *
 * // 2. 로드 후 복원
 * App loaded = AppReconstructor.fromPersisted(store.load(app.uuid()).orElseThrow());
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryAppStore implements AppStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAppStore.class);

    /**
     * Current persisted rows.
     * Key: AppId, Value: PersistedAppState
     */
    private final ConcurrentHashMap<AppId, PersistedAppState> rows;

    /**
     * Append-only event logs.
     * Key: AppId, Value: events, oldest first
     */
    private final ConcurrentHashMap<AppId, List<AppDomainEvent>> eventLogs;

    /**
     * Creates a new InMemoryAppStore with empty storage.
     */
    public InMemoryAppStore() {
        this.rows = new ConcurrentHashMap<>();
        this.eventLogs = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Maps the stored row through {@link PersistedAppStates#toSnapshot}</li>
     *   <li>SELECTED rows without a provider come back as CORRUPTED</li>
     * </ul>
     */
    @Override
    public Optional<AppSnapshot> load(AppId uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        PersistedAppState row = rows.get(uuid);
        return row == null ? Optional.empty() : Optional.of(PersistedAppStates.toSnapshot(row));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Version of a missing app is 0</li>
     *   <li>A new app's history is folded with {@link AppReducer#replay}</li>
     *   <li>An existing app's snapshot is advanced with {@link AppReducer#apply}</li>
     *   <li>On conflict nothing is written</li>
     * </ul>
     */
    @Override
    public synchronized AppendResult appendEvents(AppId uuid, List<AppDomainEvent> events, long expectedVersion) {
        validateAppend(uuid, events, expectedVersion);

        PersistedAppState current = rows.get(uuid);
        long currentVersion = current == null ? 0 : current.version();
        if (currentVersion != expectedVersion) {
            log.warn("Version conflict on {}: expected {}, actual {}", uuid, expectedVersion, currentVersion);
            return new AppendResult.Conflict(expectedVersion, currentVersion);
        }

        AppSnapshot next;
        if (current == null) {
            next = AppReducer.replay(events).orElseThrow();
        } else {
            next = PersistedAppStates.toSnapshot(current);
            for (AppDomainEvent event : events) {
                next = AppReducer.apply(next, event);
            }
        }

        rows.put(uuid, PersistedAppStates.fromSnapshot(next));
        eventLogs.computeIfAbsent(uuid, key -> new ArrayList<>()).addAll(events);

        log.debug("Appended {} event(s) to {}: version {} → {}, status {}",
            events.size(), uuid, currentVersion, next.version(), next.status());
        return new AppendResult.Appended(next.version());
    }

    /**
     * Returns a copy of the event log for the given app.
     *
     * <p>This method is used for test assertions and replay checks.</p>
     *
     * @param uuid the app ID
     * @return the events, oldest first (empty if the app does not exist)
     */
    public synchronized List<AppDomainEvent> eventsOf(AppId uuid) {
        List<AppDomainEvent> events = eventLogs.get(uuid);
        return events == null ? List.of() : List.copyOf(events);
    }

    /**
     * Returns the stored row for the given app.
     *
     * @param uuid the app ID
     * @return the row, or empty if the app does not exist
     */
    public Optional<PersistedAppState> rowOf(AppId uuid) {
        return Optional.ofNullable(rows.get(uuid));
    }

    /**
     * Overwrites the stored row without touching the event log.
     *
     * <p>This method is used to seed rows that no event history could
     * produce, such as an ACTIVE app without infrastructure.</p>
     *
     * @param row the row to store
     * @throws IllegalArgumentException if row is null
     */
    public synchronized void putRow(PersistedAppState row) {
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        rows.put(AppId.of(row.uuid()), row);
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        rows.clear();
        eventLogs.clear();
    }

    private static void validateAppend(AppId uuid, List<AppDomainEvent> events, long expectedVersion) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion cannot be negative, but was: " + expectedVersion);
        }
        for (AppDomainEvent event : events) {
            if (event == null) {
                throw new IllegalArgumentException("events cannot contain null");
            }
            if (!uuid.equals(event.uuid())) {
                throw new IllegalArgumentException(
                    String.format("Event %s belongs to %s, not %s", event.type(), event.uuid(), uuid)
                );
            }
        }
    }
}
