package com.ryuqq.provisioning.core.reducer;

import com.ryuqq.provisioning.core.event.AppActivated;
import com.ryuqq.provisioning.core.event.AppCreated;
import com.ryuqq.provisioning.core.event.AppDeleted;
import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.event.BuildRequested;
import com.ryuqq.provisioning.core.event.ExistingInfrastructureSelected;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.model.AppStatus;
import com.ryuqq.provisioning.core.model.Infrastructure;

import java.util.List;
import java.util.Optional;

/**
 * 스냅샷에 이벤트 하나를 적용하는 순수 함수.
 *
 * <p>부수 효과, I/O, 예외가 없습니다. 현재 스냅샷에서 허용되지 않는 이벤트는
 * 거부하지 않고 status를 CORRUPTED로 기록합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ExistingInfrastructureSelected: NEW + NotSelected → NEW + Selected</li>
 *   <li>AppActivated: NEW + Selected → ACTIVE</li>
 *   <li>AppDeleted: NEW, ACTIVE → DELETED (infrastructure 유지)</li>
 *   <li>BuildRequested: 항상 허용, status/infrastructure 변경 없음</li>
 *   <li>AppCreated: 기존 스냅샷에는 무시 ({@link #create(AppCreated)} 참고)</li>
 * </ul>
 *
 * <p>적용된 이벤트(불법 전이로 CORRUPTED가 된 경우 포함)는 version을 1 증가시킵니다.
 * 무시된 이벤트는 스냅샷을 그대로 반환합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class AppReducer {

    // Utility class - prevent instantiation
    private AppReducer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 이전 스냅샷이 없는 상태에 AppCreated 적용.
     *
     * @param event 생성 이벤트
     * @return NEW + NotSelected, version 1 스냅샷
     * @throws IllegalArgumentException event가 null인 경우
     */
    public static AppSnapshot create(AppCreated event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return AppSnapshot.created(event.uuid());
    }

    /**
     * 스냅샷에 이벤트 적용.
     *
     * @param snapshot 현재 스냅샷
     * @param event 적용할 이벤트
     * @return 다음 스냅샷 (불법 전이인 경우 CORRUPTED)
     * @throws IllegalArgumentException snapshot 또는 event가 null인 경우
     */
    public static AppSnapshot apply(AppSnapshot snapshot, AppDomainEvent event) {
        if (snapshot == null || event == null) {
            throw new IllegalArgumentException(
                "snapshot and event cannot be null (snapshot: " + snapshot + ", event: " + event + ")"
            );
        }

        if (event instanceof AppCreated) {
            return snapshot;
        }
        if (event instanceof ExistingInfrastructureSelected selected) {
            if (!isNewWithoutInfrastructure(snapshot)) {
                return corrupt(snapshot);
            }
            return snapshot
                .withInfrastructure(Infrastructure.selected(selected.provider()))
                .nextVersion();
        }
        if (event instanceof AppActivated) {
            if (!isNewWithInfrastructure(snapshot)) {
                return corrupt(snapshot);
            }
            return snapshot.withStatus(AppStatus.ACTIVE).nextVersion();
        }
        if (event instanceof AppDeleted) {
            if (snapshot.status() != AppStatus.NEW && snapshot.status() != AppStatus.ACTIVE) {
                return corrupt(snapshot);
            }
            return snapshot.withStatus(AppStatus.DELETED).nextVersion();
        }
        if (event instanceof BuildRequested) {
            return snapshot.nextVersion();
        }

        // event types this reducer does not know are ignored
        return snapshot;
    }

    /**
     * 빈 이력에서 시작해 이벤트 목록을 순서대로 fold.
     *
     * <p>첫 이벤트가 AppCreated가 아니면 그 이벤트의 uuid로 CORRUPTED 스냅샷을 만들고
     * 나머지 이벤트를 계속 적용합니다.</p>
     *
     * @param history 이벤트 이력 (오래된 순)
     * @return 재구성된 스냅샷, 이력이 비어 있으면 empty
     * @throws IllegalArgumentException history가 null이거나 null 원소를 포함한 경우
     */
    public static Optional<AppSnapshot> replay(List<? extends AppDomainEvent> history) {
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (history.isEmpty()) {
            return Optional.empty();
        }

        AppDomainEvent first = requireEvent(history.get(0));
        AppSnapshot snapshot = first instanceof AppCreated created
            ? create(created)
            : new AppSnapshot(first.uuid(), AppStatus.CORRUPTED, Infrastructure.notSelected(), 1);

        for (AppDomainEvent event : history.subList(1, history.size())) {
            snapshot = apply(snapshot, requireEvent(event));
        }
        return Optional.of(snapshot);
    }

    private static boolean isNewWithoutInfrastructure(AppSnapshot snapshot) {
        return snapshot.status() == AppStatus.NEW && !snapshot.infrastructure().isSelected();
    }

    private static boolean isNewWithInfrastructure(AppSnapshot snapshot) {
        return snapshot.status() == AppStatus.NEW && snapshot.infrastructure().isSelected();
    }

    private static AppSnapshot corrupt(AppSnapshot snapshot) {
        return snapshot.withStatus(AppStatus.CORRUPTED).nextVersion();
    }

    private static AppDomainEvent requireEvent(AppDomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("history cannot contain null events");
        }
        return event;
    }
}
