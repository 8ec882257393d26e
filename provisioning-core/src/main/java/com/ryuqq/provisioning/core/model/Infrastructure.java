package com.ryuqq.provisioning.core.model;

/**
 * App의 인프라 선택 상태.
 *
 * <p>두 가지 경우만 존재합니다:</p>
 * <ul>
 *   <li>{@link NotSelected}: 아직 인프라 제공자를 선택하지 않음</li>
 *   <li>{@link Selected}: 제공자가 선택됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 "선택됨인데 제공자가 없음" 같은 상태를
 * 표현할 수 없습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface Infrastructure permits Infrastructure.NotSelected, Infrastructure.Selected {

    /**
     * 인프라 미선택 상태 반환.
     *
     * @return NotSelected 싱글톤
     */
    static Infrastructure notSelected() {
        return NotSelected.INSTANCE;
    }

    /**
     * 인프라 선택 상태 생성.
     *
     * @param provider 선택된 제공자
     * @return Selected 인스턴스
     * @throws IllegalArgumentException provider가 null인 경우
     */
    static Infrastructure selected(InfrastructureProvider provider) {
        return new Selected(provider);
    }

    /**
     * 선택 여부 확인.
     *
     * @return Selected인 경우 true
     */
    default boolean isSelected() {
        return this instanceof Selected;
    }

    /**
     * 인프라 미선택.
     */
    final class NotSelected implements Infrastructure {

        private static final NotSelected INSTANCE = new NotSelected();

        private NotSelected() {
        }

        @Override
        public String toString() {
            return "NotSelected";
        }
    }

    /**
     * 인프라 선택됨.
     *
     * @param provider 선택된 제공자
     */
    record Selected(InfrastructureProvider provider) implements Infrastructure {

        public Selected {
            if (provider == null) {
                throw new IllegalArgumentException("provider cannot be null");
            }
        }
    }
}
