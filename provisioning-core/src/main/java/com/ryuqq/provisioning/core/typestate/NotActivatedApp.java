package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppActivated;
import com.ryuqq.provisioning.core.event.AppDeleted;
import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.event.BuildRequested;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.Infrastructure;
import com.ryuqq.provisioning.core.model.InfrastructureChoice;
import com.ryuqq.provisioning.core.model.InfrastructureProvider;

import java.util.List;
import java.util.Objects;

/**
 * 인프라는 선택됐지만 아직 활성화되지 않은 App (status = NEW, Selected).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class NotActivatedApp implements App {

    private final AppSnapshot snapshot;
    private final List<AppDomainEvent> events;

    NotActivatedApp(AppSnapshot snapshot, List<AppDomainEvent> events) {
        Transitions.requireKind(snapshot, AppKind.NOT_ACTIVATED);
        this.snapshot = snapshot;
        this.events = Transitions.copyEvents(events);
    }

    /**
     * 선택된 인프라 제공자.
     *
     * @return 제공자
     */
    public InfrastructureProvider provider() {
        return ((Infrastructure.Selected) snapshot.infrastructure()).provider();
    }

    /**
     * 활성화.
     *
     * @return AppActivated 이벤트를 가진 ActiveApp
     */
    public ActiveApp activate() {
        AppActivated event = new AppActivated(snapshot.uuid());
        return new ActiveApp(Transitions.reduce(snapshot, event), List.of(event));
    }

    /**
     * 선택된 인프라에 대한 빌드 요청.
     *
     * <p>상태는 바뀌지 않고 version만 증가합니다. 발생한 {@link BuildRequested} 이벤트는
     * 외부 프로비저닝 협력자가 소비합니다.</p>
     *
     * @param infrastructure 빌드 대상 인프라 (제공자가 선택된 제공자와 같아야 함)
     * @return BuildRequested 이벤트를 가진 NotActivatedApp
     * @throws IllegalArgumentException infrastructure가 null이거나 제공자가 다른 경우
     */
    public NotActivatedApp requestBuild(InfrastructureChoice infrastructure) {
        if (infrastructure == null) {
            throw new IllegalArgumentException("infrastructure cannot be null");
        }
        if (infrastructure.provider() != provider()) {
            throw new IllegalArgumentException(
                String.format("Build target %s does not match selected provider %s",
                    infrastructure.provider(), provider())
            );
        }
        BuildRequested event = new BuildRequested(snapshot.uuid(), infrastructure);
        return new NotActivatedApp(Transitions.reduce(snapshot, event), List.of(event));
    }

    /**
     * 삭제.
     *
     * @return AppDeleted 이벤트를 가진 DeletedApp
     */
    public DeletedApp delete() {
        AppDeleted event = new AppDeleted(snapshot.uuid());
        return new DeletedApp(Transitions.reduce(snapshot, event), List.of(event));
    }

    @Override
    public AppSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public List<AppDomainEvent> events() {
        return events;
    }

    @Override
    public AppKind kind() {
        return AppKind.NOT_ACTIVATED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotActivatedApp that = (NotActivatedApp) o;
        return snapshot.equals(that.snapshot) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot, events);
    }

    @Override
    public String toString() {
        return "NotActivatedApp{" + snapshot + ", events=" + events + '}';
    }
}
