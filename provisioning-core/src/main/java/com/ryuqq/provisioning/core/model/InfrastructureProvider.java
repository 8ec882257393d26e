package com.ryuqq.provisioning.core.model;

/**
 * 인프라 제공자.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum InfrastructureProvider {
    AWS,
    AZURE
}
