package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.PersistedAppState;
import com.ryuqq.provisioning.core.model.PersistedAppStates;

import java.util.List;

/**
 * 영속 스냅샷을 Typestate 변형으로 복원.
 *
 * <p>신뢰할 수 없는 영속 데이터를 불변식에 대해 다시 검증하는 유일한 지점입니다.
 * 어떤 스냅샷이든 정확히 하나의 변형으로 매핑되며(total), 불변식을 위반한 스냅샷은
 * {@link CorruptedApp}이 됩니다.</p>
 *
 * <p><strong>매핑 규칙:</strong></p>
 * <ol>
 *   <li>NEW + NotSelected → {@link NewApp}</li>
 *   <li>NEW + Selected → {@link NotActivatedApp}</li>
 *   <li>ACTIVE + Selected → {@link ActiveApp}</li>
 *   <li>DELETED + (any) → {@link DeletedApp}</li>
 *   <li>그 외 (ACTIVE + NotSelected, CORRUPTED) → {@link CorruptedApp}</li>
 * </ol>
 *
 * <p>복원된 변형의 {@link App#events()}는 비어 있습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class AppReconstructor {

    // Utility class - prevent instantiation
    private AppReconstructor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 스냅샷에서 변형 복원.
     *
     * @param snapshot 영속 계층에서 읽은 스냅샷
     * @return 해당 변형
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public static App fromPersisted(AppSnapshot snapshot) {
        return switch (AppKind.of(snapshot)) {
            case NEW -> new NewApp(snapshot, List.of());
            case NOT_ACTIVATED -> new NotActivatedApp(snapshot, List.of());
            case ACTIVE -> new ActiveApp(snapshot, List.of());
            case DELETED -> new DeletedApp(snapshot, List.of());
            case CORRUPTED -> new CorruptedApp(snapshot, List.of());
        };
    }

    /**
     * 평면 영속 레이아웃에서 변형 복원.
     *
     * <p>인프라 컬럼이 서로 맞지 않는 행은 CORRUPTED 스냅샷으로 매핑된 뒤
     * {@link CorruptedApp}이 됩니다.</p>
     *
     * @param row 영속 행
     * @return 해당 변형
     * @throws IllegalArgumentException row가 null인 경우
     */
    public static App fromPersisted(PersistedAppState row) {
        return fromPersisted(PersistedAppStates.toSnapshot(row));
    }
}
