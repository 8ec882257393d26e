package com.ryuqq.provisioning.core.model;

/**
 * App의 전역 고유 식별자.
 *
 * <p>AppId는 엔티티 생명주기 동안 변하지 않으며, 모든 도메인 이벤트의
 * payload에 포함됩니다. 값 자체는 불투명(opaque)하게 취급합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class AppId {

    private final String value;

    private AppId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AppId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("AppId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * AppId 생성.
     *
     * @param value AppId 값
     * @return AppId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AppId of(String value) {
        return new AppId(value);
    }

    /**
     * AppId 값 조회.
     *
     * @return AppId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppId appId = (AppId) o;
        return value.equals(appId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AppId{" + value + '}';
    }
}
