package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppDeleted;
import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.event.ExistingInfrastructureSelected;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.InfrastructureChoice;

import java.util.List;
import java.util.Objects;

/**
 * 인프라를 아직 선택하지 않은 App (status = NEW, NotSelected).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class NewApp implements App {

    private final AppSnapshot snapshot;
    private final List<AppDomainEvent> events;

    NewApp(AppSnapshot snapshot, List<AppDomainEvent> events) {
        Transitions.requireKind(snapshot, AppKind.NEW);
        this.snapshot = snapshot;
        this.events = Transitions.copyEvents(events);
    }

    /**
     * 기존 인프라 선택.
     *
     * <p>AWS는 리전이 필수이고 Azure는 리전을 받지 않습니다.
     * 이 제약은 {@link InfrastructureChoice} 생성 시점에 강제됩니다.</p>
     *
     * @param infrastructure 선택할 인프라
     * @return ExistingInfrastructureSelected 이벤트를 가진 NotActivatedApp
     * @throws IllegalArgumentException infrastructure가 null인 경우
     */
    public NotActivatedApp selectInfrastructure(InfrastructureChoice infrastructure) {
        ExistingInfrastructureSelected event = new ExistingInfrastructureSelected(snapshot.uuid(), infrastructure);
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
        return AppKind.NEW;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NewApp that = (NewApp) o;
        return snapshot.equals(that.snapshot) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot, events);
    }

    @Override
    public String toString() {
        return "NewApp{" + snapshot + ", events=" + events + '}';
    }
}
