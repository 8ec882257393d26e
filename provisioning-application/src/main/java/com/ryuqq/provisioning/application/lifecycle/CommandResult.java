package com.ryuqq.provisioning.application.lifecycle;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppId;
import com.ryuqq.provisioning.core.typestate.App;

import java.util.List;

/**
 * 명령 실행 결과.
 *
 * <p>세 가지 가능한 결과:</p>
 * <ul>
 *   <li>{@link Applied}: 이벤트가 저장됨</li>
 *   <li>{@link Conflict}: 낙관적 동시성 충돌, 다시 로드 후 재시도 가능</li>
 *   <li>{@link Rejected}: 현재 상태에서 수행할 수 없는 명령, 재시도 불가</li>
 * </ul>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>{@value #NOT_FOUND}: App 없음</li>
 *   <li>{@value #ALREADY_EXISTS}: 이미 존재하는 App 생성 시도</li>
 *   <li>{@value #INVALID_ARGUMENT}: 인자가 현재 App과 맞지 않음</li>
 *   <li>{@value #NOT_AVAILABLE}: 현재 변형이 해당 연산을 노출하지 않음 (Deleted, Corrupted 포함)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface CommandResult permits CommandResult.Applied, CommandResult.Conflict, CommandResult.Rejected {

    String NOT_FOUND = "APP-404";
    String ALREADY_EXISTS = "APP-409";
    String INVALID_ARGUMENT = "APP-400";
    String NOT_AVAILABLE = "APP-422";

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isApplied() {
        return this instanceof Applied;
    }

    /**
     * 성공 결과.
     *
     * <p>{@code appended}는 이번 명령으로 저장된 이벤트 전체입니다. 명령 하나가 Typestate 연산을
     * 여러 번 이어 호출하면 (인프라 선택 후 빌드 자동 요청) {@code app.events()}에는 마지막 연산의
     * 이벤트만 남고, {@code app.snapshot().version()}은 {@code appended}를 모두 반영합니다.</p>
     *
     * @param app 명령 적용 후 App 변형
     * @param appended 저장된 이벤트 (오래된 순)
     */
    record Applied(App app, List<AppDomainEvent> appended) implements CommandResult {

        public Applied {
            if (app == null) {
                throw new IllegalArgumentException("app cannot be null");
            }
            if (appended == null || appended.isEmpty()) {
                throw new IllegalArgumentException("appended cannot be null or empty");
            }
            appended = List.copyOf(appended);
        }
    }

    /**
     * 낙관적 동시성 충돌.
     *
     * @param uuid App ID
     * @param expectedVersion 로드 시점의 version
     * @param actualVersion 저장소의 현재 version
     */
    record Conflict(AppId uuid, long expectedVersion, long actualVersion) implements CommandResult {

        public Conflict {
            if (uuid == null) {
                throw new IllegalArgumentException("uuid cannot be null");
            }
        }
    }

    /**
     * 거부된 명령.
     *
     * @param errorCode 오류 코드 (예: APP-404)
     * @param message 오류 메시지
     */
    record Rejected(String errorCode, String message) implements CommandResult {

        public Rejected {
            if (errorCode == null || errorCode.isBlank()) {
                throw new IllegalArgumentException("errorCode cannot be null or blank");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
        }
    }
}
