package com.ryuqq.provisioning.core.model;

/**
 * 인프라 선택 인자.
 *
 * <p>제공자별로 필요한 파라미터가 다르므로 sum type으로 표현합니다:</p>
 * <ul>
 *   <li>{@link Aws}: 리전 필수</li>
 *   <li>{@link Azure}: 추가 파라미터 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * InfrastructureChoice aws = InfrastructureChoice.aws(AwsRegion.of("us-east-1"));
 * InfrastructureChoice azure = InfrastructureChoice.azure();
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface InfrastructureChoice permits InfrastructureChoice.Aws, InfrastructureChoice.Azure {

    /**
     * 선택한 제공자.
     *
     * @return 제공자
     */
    InfrastructureProvider provider();

    /**
     * AWS 선택 생성.
     *
     * @param region 리전
     * @return Aws 인스턴스
     * @throws IllegalArgumentException region이 null인 경우
     */
    static InfrastructureChoice aws(AwsRegion region) {
        return new Aws(region);
    }

    /**
     * Azure 선택 생성.
     *
     * @return Azure 인스턴스
     */
    static InfrastructureChoice azure() {
        return new Azure();
    }

    /**
     * AWS 선택.
     *
     * @param region 리전
     */
    record Aws(AwsRegion region) implements InfrastructureChoice {

        public Aws {
            if (region == null) {
                throw new IllegalArgumentException("region cannot be null for AWS");
            }
        }

        @Override
        public InfrastructureProvider provider() {
            return InfrastructureProvider.AWS;
        }
    }

    /**
     * Azure 선택.
     */
    record Azure() implements InfrastructureChoice {

        @Override
        public InfrastructureProvider provider() {
            return InfrastructureProvider.AZURE;
        }
    }
}
