package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppDeleted;
import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.Infrastructure;
import com.ryuqq.provisioning.core.model.InfrastructureProvider;

import java.util.List;
import java.util.Objects;

/**
 * 활성화된 App (status = ACTIVE, Selected).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ActiveApp implements App {

    private final AppSnapshot snapshot;
    private final List<AppDomainEvent> events;

    ActiveApp(AppSnapshot snapshot, List<AppDomainEvent> events) {
        Transitions.requireKind(snapshot, AppKind.ACTIVE);
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
        return AppKind.ACTIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActiveApp that = (ActiveApp) o;
        return snapshot.equals(that.snapshot) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot, events);
    }

    @Override
    public String toString() {
        return "ActiveApp{" + snapshot + ", events=" + events + '}';
    }
}
