package com.ryuqq.provisioning.core.event;

import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.InfrastructureChoice;
import com.ryuqq.provisioning.core.model.InfrastructureProvider;

/**
 * 빌드 요청 이벤트.
 *
 * <p>스냅샷을 바꾸지 않으며, 외부 프로비저닝 협력자에게 실제 클라우드 작업을
 * 요청하는 신호로만 쓰입니다.</p>
 *
 * @param uuid App ID
 * @param infrastructure 빌드 대상 인프라
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BuildRequested(
    AppId uuid,
    InfrastructureChoice infrastructure
) implements AppDomainEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException uuid 또는 infrastructure가 null인 경우
     */
    public BuildRequested {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        if (infrastructure == null) {
            throw new IllegalArgumentException("infrastructure cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.BUILD_REQUESTED;
    }

    /**
     * 빌드 대상 제공자.
     *
     * @return 제공자
     */
    public InfrastructureProvider provider() {
        return infrastructure.provider();
    }
}
