package com.ryuqq.provisioning.application.lifecycle;

/**
 * AppLifecycleService 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>requestBuildOnSelection: 인프라 선택과 함께 BuildRequested도 발생시킬지 여부 (기본 false)</li>
 *   <li>publishProvisioningEvents: append 성공 후 프로비저닝 이벤트를 발행할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p>requestBuildOnSelection이 true이면 selectInfrastructure 한 번에
 * ExistingInfrastructureSelected, BuildRequested 두 이벤트가 함께 append됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param requestBuildOnSelection 인프라 선택 시 빌드 요청 자동 발생 여부
 * @param publishProvisioningEvents 프로비저닝 이벤트 발행 여부
 */
public record AppLifecycleConfig(boolean requestBuildOnSelection, boolean publishProvisioningEvents) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: requestBuildOnSelection=false, publishProvisioningEvents=true</p>
     */
    public AppLifecycleConfig() {
        this(false, true);
    }

    /**
     * requestBuildOnSelection만 변경한 새 인스턴스 생성.
     *
     * @param requestBuildOnSelection 새 값
     * @return 새 AppLifecycleConfig 인스턴스
     */
    public AppLifecycleConfig withRequestBuildOnSelection(boolean requestBuildOnSelection) {
        return new AppLifecycleConfig(requestBuildOnSelection, this.publishProvisioningEvents);
    }

    /**
     * publishProvisioningEvents만 변경한 새 인스턴스 생성.
     *
     * @param publishProvisioningEvents 새 값
     * @return 새 AppLifecycleConfig 인스턴스
     */
    public AppLifecycleConfig withPublishProvisioningEvents(boolean publishProvisioningEvents) {
        return new AppLifecycleConfig(this.requestBuildOnSelection, publishProvisioningEvents);
    }
}
