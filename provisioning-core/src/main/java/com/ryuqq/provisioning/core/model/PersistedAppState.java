package com.ryuqq.provisioning.core.model;

/**
 * Flat, format-agnostic persisted layout of one app.
 *
 * <p>This mirrors what a storage row looks like: the infrastructure sum type
 * is split into a status flag and an optional provider column. Nothing stops
 * a row from being inconsistent (for example {@code SELECTED} with no
 * provider); such rows are mapped to a {@link AppStatus#CORRUPTED} snapshot
 * by {@link PersistedAppStates#toSnapshot(PersistedAppState)}.</p>
 *
 * @param uuid the app identifier value
 * @param status the persisted status
 * @param infrastructureStatus the persisted selection flag
 * @param infrastructureProvider the provider, present iff selected (nullable)
 * @param version the number of events applied
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record PersistedAppState(
    String uuid,
    AppStatus status,
    InfrastructureStatus infrastructureStatus,
    InfrastructureProvider infrastructureProvider,
    long version
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if uuid, status or infrastructureStatus is null
     */
    public PersistedAppState {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (infrastructureStatus == null) {
            throw new IllegalArgumentException("infrastructureStatus cannot be null");
        }
        // infrastructureProvider may be null
    }
}
