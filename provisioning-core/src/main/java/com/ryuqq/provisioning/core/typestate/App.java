package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppCreated;
import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.AppStatus;
import com.ryuqq.provisioning.core.reducer.AppReducer;

import java.util.List;

/**
 * Typestate로 표현한 App 엔티티.
 *
 * <p>각 변형은 해당 상태에서 허용되는 연산만 노출합니다. 허용되지 않는 연산은
 * 런타임 오류가 아니라 컴파일 오류가 됩니다.</p>
 *
 * <ul>
 *   <li>{@link NewApp}: selectInfrastructure, delete</li>
 *   <li>{@link NotActivatedApp}: activate, requestBuild, delete</li>
 *   <li>{@link ActiveApp}: delete</li>
 *   <li>{@link DeletedApp}: 없음</li>
 *   <li>{@link CorruptedApp}: 없음</li>
 * </ul>
 *
 * <p>변형은 불변 값입니다. 전이 메서드는 원본을 바꾸지 않고 새 변형을 반환하며,
 * 호출자는 전이 이전 값을 더 이상 현재 상태로 사용하면 안 됩니다.</p>
 *
 * <p><strong>Pattern Matching 예시:</strong></p>
 * <pre>
 * App app = AppReconstructor.fromPersisted(snapshot);
 * if (app instanceof NotActivatedApp notActivated) {
 *     ActiveApp active = notActivated.activate();
 *     store.appendEvents(active.uuid(), active.events(), snapshot.version());
 * }
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface App permits NewApp, NotActivatedApp, ActiveApp, DeletedApp, CorruptedApp {

    /**
     * 새 App 생성.
     *
     * <p>기존 스냅샷에 대한 전이가 아니라 별도의 생성자입니다.
     * 결과는 {@link AppCreated} 이벤트 하나를 가진 {@link NewApp}입니다.</p>
     *
     * @param uuid App ID
     * @return NewApp
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    static NewApp create(AppId uuid) {
        AppCreated event = new AppCreated(uuid);
        return new NewApp(AppReducer.create(event), List.of(event));
    }

    /**
     * 감싼 스냅샷.
     *
     * @return 스냅샷
     */
    AppSnapshot snapshot();

    /**
     * 이 인스턴스를 만든 연산이 발생시킨 이벤트.
     *
     * <p>영속 상태에서 복원한 경우 비어 있습니다. 이벤트 저장은 호출자 책임입니다.</p>
     *
     * @return 불변 이벤트 목록
     */
    List<AppDomainEvent> events();

    /**
     * 변형 종류.
     *
     * @return AppKind
     */
    AppKind kind();

    /**
     * App ID.
     *
     * @return App ID
     */
    default AppId uuid() {
        return snapshot().uuid();
    }

    /**
     * 스냅샷 상태.
     *
     * @return AppStatus
     */
    default AppStatus status() {
        return snapshot().status();
    }
}
