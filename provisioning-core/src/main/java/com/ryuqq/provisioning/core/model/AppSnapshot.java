package com.ryuqq.provisioning.core.model;

/**
 * App의 현재 상태 스냅샷.
 *
 * <p>이벤트 이력을 fold한 결과물이며, 영속 계층에 저장되는 논리적 상태입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>status == ACTIVE 이면 infrastructure는 반드시 {@link Infrastructure.Selected}</li>
 *   <li>status == NEW 는 NotSelected, Selected 모두 허용</li>
 *   <li>status == CORRUPTED 는 구조적 보장 없음</li>
 * </ul>
 *
 * <p>불변식은 생성 시점에 강제하지 않습니다. 영속된 스냅샷은 어떤 값이든 될 수 있고,
 * 검증은 {@link #satisfiesInvariant()}와 복원 단계에서 수행합니다.</p>
 *
 * @param uuid App 식별자
 * @param status 생명주기 상태
 * @param infrastructure 인프라 선택 상태
 * @param version 적용된 이벤트 수 (낙관적 동시성 제어용)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record AppSnapshot(
    AppId uuid,
    AppStatus status,
    Infrastructure infrastructure,
    long version
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 version이 음수인 경우
     */
    public AppSnapshot {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (infrastructure == null) {
            throw new IllegalArgumentException("infrastructure cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative, but was: " + version);
        }
    }

    /**
     * 생성 직후 스냅샷 (NEW, NotSelected, version 1).
     *
     * @param uuid App 식별자
     * @return 초기 스냅샷
     */
    public static AppSnapshot created(AppId uuid) {
        return new AppSnapshot(uuid, AppStatus.NEW, Infrastructure.notSelected(), 1);
    }

    /**
     * status만 변경한 새 스냅샷.
     *
     * @param status 새 상태
     * @return 새 AppSnapshot
     */
    public AppSnapshot withStatus(AppStatus status) {
        return new AppSnapshot(uuid, status, infrastructure, version);
    }

    /**
     * infrastructure만 변경한 새 스냅샷.
     *
     * @param infrastructure 새 인프라 상태
     * @return 새 AppSnapshot
     */
    public AppSnapshot withInfrastructure(Infrastructure infrastructure) {
        return new AppSnapshot(uuid, status, infrastructure, version);
    }

    /**
     * version을 1 증가시킨 새 스냅샷.
     *
     * @return 새 AppSnapshot
     */
    public AppSnapshot nextVersion() {
        return new AppSnapshot(uuid, status, infrastructure, version + 1);
    }

    /**
     * 구조적 불변식 충족 여부.
     *
     * @return ACTIVE가 아니거나, ACTIVE이면서 인프라가 선택된 경우 true
     */
    public boolean satisfiesInvariant() {
        return status != AppStatus.ACTIVE || infrastructure.isSelected();
    }
}
