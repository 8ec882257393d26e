package com.ryuqq.provisioning.core.event;

import com.ryuqq.provisioning.core.model.AppId;

/**
 * App 상태 변경을 기록하는 불변 도메인 이벤트.
 *
 * <p>이벤트는 한 번 쓰이면 바뀌지 않으며, 순서대로 append되어
 * 스냅샷을 재구성할 수 있는 이력을 이룹니다.</p>
 *
 * <ul>
 *   <li>{@link AppCreated}</li>
 *   <li>{@link ExistingInfrastructureSelected}</li>
 *   <li>{@link BuildRequested}</li>
 *   <li>{@link AppActivated}</li>
 *   <li>{@link AppDeleted}</li>
 * </ul>
 *
 * <p>payload의 현재 상태 대비 적법성은 이벤트가 아니라
 * {@link com.ryuqq.provisioning.core.reducer.AppReducer}가 판단합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface AppDomainEvent
    permits AppCreated, ExistingInfrastructureSelected, BuildRequested, AppActivated, AppDeleted {

    /**
     * 이벤트 타입 태그.
     *
     * @return 이벤트 타입
     */
    EventType type();

    /**
     * 대상 App 식별자.
     *
     * @return App ID
     */
    AppId uuid();
}
