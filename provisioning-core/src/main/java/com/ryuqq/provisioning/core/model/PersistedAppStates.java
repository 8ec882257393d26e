package com.ryuqq.provisioning.core.model;

/**
 * Mapping between {@link PersistedAppState} rows and {@link AppSnapshot}s.
 *
 * <p>The selection flag decides. A {@code NOT_SELECTED} row maps to
 * {@link Infrastructure.NotSelected} and its provider column is ignored.
 * A {@code SELECTED} row without a provider cannot be turned into an
 * {@link Infrastructure} value; it becomes a CORRUPTED snapshot with
 * {@link Infrastructure.NotSelected}, keeping uuid and version.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class PersistedAppStates {

    private PersistedAppStates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Maps a persisted row to a snapshot.
     *
     * @param row the persisted row
     * @return the snapshot (CORRUPTED if the row is SELECTED without a provider)
     * @throws IllegalArgumentException if row is null
     */
    public static AppSnapshot toSnapshot(PersistedAppState row) {
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        AppId uuid = AppId.of(row.uuid());
        if (row.infrastructureStatus() != InfrastructureStatus.SELECTED) {
            return new AppSnapshot(uuid, row.status(), Infrastructure.notSelected(), row.version());
        }
        if (row.infrastructureProvider() == null) {
            return new AppSnapshot(uuid, AppStatus.CORRUPTED, Infrastructure.notSelected(), row.version());
        }
        return new AppSnapshot(uuid, row.status(), Infrastructure.selected(row.infrastructureProvider()), row.version());
    }

    /**
     * Maps a snapshot to its persisted row.
     *
     * @param snapshot the snapshot
     * @return the persisted row
     * @throws IllegalArgumentException if snapshot is null
     */
    public static PersistedAppState fromSnapshot(AppSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (snapshot.infrastructure() instanceof Infrastructure.Selected selected) {
            return new PersistedAppState(
                snapshot.uuid().getValue(),
                snapshot.status(),
                InfrastructureStatus.SELECTED,
                selected.provider(),
                snapshot.version()
            );
        }
        return new PersistedAppState(
            snapshot.uuid().getValue(),
            snapshot.status(),
            InfrastructureStatus.NOT_SELECTED,
            null,
            snapshot.version()
        );
    }
}
