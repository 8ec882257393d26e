package com.ryuqq.provisioning.core.event;

/**
 * 도메인 이벤트 타입 태그.
 *
 * <p>영속 계층에서 이벤트 종류를 구분하는 문자열 값({@link #getValue()})을
 * 함께 제공합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum EventType {

    APP_CREATED("AppCreated"),
    EXISTING_INFRASTRUCTURE_SELECTED("ExistingInfrastructureSelected"),
    BUILD_REQUESTED("BuildRequested"),
    APP_ACTIVATED("AppActivated"),
    APP_DELETED("AppDeleted");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /**
     * 영속용 타입 이름 조회.
     *
     * @return 타입 이름 (예: "AppCreated")
     */
    public String getValue() {
        return value;
    }

    /**
     * 프로비저닝 협력자가 소비해야 하는 이벤트인지 확인.
     *
     * @return EXISTING_INFRASTRUCTURE_SELECTED 또는 BUILD_REQUESTED인 경우 true
     */
    public boolean isProvisioningSignal() {
        return this == EXISTING_INFRASTRUCTURE_SELECTED || this == BUILD_REQUESTED;
    }
}
