package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppSnapshot;

import java.util.List;
import java.util.Objects;

/**
 * 삭제된 App. 종료 상태이며 노출되는 연산이 없습니다.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class DeletedApp implements App {

    private final AppSnapshot snapshot;
    private final List<AppDomainEvent> events;

    DeletedApp(AppSnapshot snapshot, List<AppDomainEvent> events) {
        Transitions.requireKind(snapshot, AppKind.DELETED);
        this.snapshot = snapshot;
        this.events = Transitions.copyEvents(events);
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
        return AppKind.DELETED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeletedApp that = (DeletedApp) o;
        return snapshot.equals(that.snapshot) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot, events);
    }

    @Override
    public String toString() {
        return "DeletedApp{" + snapshot + ", events=" + events + '}';
    }
}
