package com.ryuqq.provisioning.core.model;

/**
 * AWS 리전 코드.
 *
 * <p>리전 카탈로그 검증은 하지 않습니다. 이 타입은 AWS 인프라 선택 시 리전이
 * 필수라는 사실을 타입 수준에서 표현하기 위한 태그입니다.</p>
 *
 * <p><strong>예시:</strong> {@code AwsRegion.of("us-east-1")}</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class AwsRegion {

    private final String code;

    private AwsRegion(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("AwsRegion code cannot be null or blank");
        }
        this.code = code;
    }

    /**
     * AwsRegion 생성.
     *
     * @param code 리전 코드 (예: us-east-1)
     * @return AwsRegion 인스턴스
     * @throws IllegalArgumentException code가 null이거나 빈 문자열인 경우
     */
    public static AwsRegion of(String code) {
        return new AwsRegion(code);
    }

    /**
     * 리전 코드 조회.
     *
     * @return 리전 코드
     */
    public String getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AwsRegion that = (AwsRegion) o;
        return code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return "AwsRegion{" + code + '}';
    }
}
