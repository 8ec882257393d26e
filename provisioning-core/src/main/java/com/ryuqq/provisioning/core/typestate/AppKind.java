package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.model.AppSnapshot;

/**
 * Typestate 변형 종류.
 *
 * <p>스냅샷 하나가 어떤 변형에 해당하는지 결정하는 유일한 규칙입니다.
 * 두 변형(NEW, NOT_ACTIVATED)은 같은 {@code status = NEW}를 보고하지만
 * 인프라 선택 여부로 구분됩니다.</p>
 *
 * <pre>
 * NEW + NotSelected      → NEW
 * NEW + Selected         → NOT_ACTIVATED
 * ACTIVE + Selected      → ACTIVE
 * DELETED + (any)        → DELETED
 * 그 외                   → CORRUPTED
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum AppKind {
    NEW,
    NOT_ACTIVATED,
    ACTIVE,
    DELETED,
    CORRUPTED;

    /**
     * 스냅샷 분류.
     *
     * @param snapshot 분류할 스냅샷
     * @return 해당 변형 종류
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public static AppKind of(AppSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        boolean selected = snapshot.infrastructure().isSelected();
        return switch (snapshot.status()) {
            case NEW -> selected ? NOT_ACTIVATED : NEW;
            case ACTIVE -> selected ? ACTIVE : CORRUPTED;
            case DELETED -> DELETED;
            case CORRUPTED -> CORRUPTED;
        };
    }
}
