package com.ryuqq.provisioning.core.spi;

/**
 * Result of {@link AppStore#appendEvents}.
 *
 * <ul>
 *   <li>{@link Appended}: events stored, version advanced</li>
 *   <li>{@link Conflict}: stored version differed from the expected one, nothing stored</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface AppendResult permits AppendResult.Appended, AppendResult.Conflict {

    /**
     * Checks whether the append succeeded.
     *
     * @return true if this is {@link Appended}
     */
    default boolean isAppended() {
        return this instanceof Appended;
    }

    /**
     * Events were stored.
     *
     * @param newVersion the version after the append
     */
    record Appended(long newVersion) implements AppendResult {

        public Appended {
            if (newVersion <= 0) {
                throw new IllegalArgumentException("newVersion must be positive, but was: " + newVersion);
            }
        }
    }

    /**
     * Optimistic concurrency conflict.
     *
     * @param expectedVersion the version the caller expected
     * @param actualVersion the version currently stored (0 if the app does not exist)
     */
    record Conflict(long expectedVersion, long actualVersion) implements AppendResult {

        public Conflict {
            if (expectedVersion == actualVersion) {
                throw new IllegalArgumentException("Conflict requires differing versions, both were: " + actualVersion);
            }
        }
    }
}
