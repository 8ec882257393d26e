package com.ryuqq.provisioning.core.event;

import com.ryuqq.provisioning.core.model.AppId;

/**
 * App 생성 이벤트.
 *
 * @param uuid App ID
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record AppCreated(AppId uuid) implements AppDomainEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    public AppCreated {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.APP_CREATED;
    }
}
