package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.AppStatus;

import java.util.List;
import java.util.Objects;

/**
 * 손상된 App. 종료 상태이며 노출되는 연산이 없습니다.
 *
 * <p>불법 이벤트를 본 적이 있거나 불변식을 위반한 스냅샷에서 복원된 경우입니다.
 * 구조적 불변식을 더 이상 신뢰하지 않으므로 관리자 복구가 필요합니다.
 * 감싼 스냅샷의 status는 항상 {@link AppStatus#CORRUPTED}입니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class CorruptedApp implements App {

    private final AppSnapshot snapshot;
    private final List<AppDomainEvent> events;

    CorruptedApp(AppSnapshot snapshot, List<AppDomainEvent> events) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        this.snapshot = snapshot.status() == AppStatus.CORRUPTED
            ? snapshot
            : snapshot.withStatus(AppStatus.CORRUPTED);
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
        return AppKind.CORRUPTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorruptedApp that = (CorruptedApp) o;
        return snapshot.equals(that.snapshot) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot, events);
    }

    @Override
    public String toString() {
        return "CorruptedApp{" + snapshot + ", events=" + events + '}';
    }
}
