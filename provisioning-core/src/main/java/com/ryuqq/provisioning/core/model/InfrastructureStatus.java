package com.ryuqq.provisioning.core.model;

/**
 * Persisted infrastructure selection flag.
 *
 * <p>Only used by the flat {@link PersistedAppState} layout; in-process code
 * works with the {@link Infrastructure} sum type instead.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum InfrastructureStatus {
    NOT_SELECTED,
    SELECTED
}
