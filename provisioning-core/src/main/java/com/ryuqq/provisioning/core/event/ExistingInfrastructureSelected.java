package com.ryuqq.provisioning.core.event;

import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.InfrastructureChoice;
import com.ryuqq.provisioning.core.model.InfrastructureProvider;

/**
 * 기존 인프라 선택 이벤트.
 *
 * <p>제공자를 지정하지 않고는 생성할 수 없습니다. AWS인 경우 리전이
 * {@link InfrastructureChoice.Aws}에 포함되며, Azure는 리전이 없습니다.</p>
 *
 * @param uuid App ID
 * @param infrastructure 선택된 인프라
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ExistingInfrastructureSelected(
    AppId uuid,
    InfrastructureChoice infrastructure
) implements AppDomainEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException uuid 또는 infrastructure가 null인 경우
     */
    public ExistingInfrastructureSelected {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        if (infrastructure == null) {
            throw new IllegalArgumentException("infrastructure cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.EXISTING_INFRASTRUCTURE_SELECTED;
    }

    /**
     * 선택된 제공자.
     *
     * @return 제공자
     */
    public InfrastructureProvider provider() {
        return infrastructure.provider();
    }
}
