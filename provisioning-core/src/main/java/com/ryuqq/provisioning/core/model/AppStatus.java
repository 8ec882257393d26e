package com.ryuqq.provisioning.core.model;

/**
 * App의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>NEW → NEW (인프라 선택, infrastructure만 변경)</li>
 *   <li>NEW → ACTIVE (활성화, 인프라 선택 후에만)</li>
 *   <li>NEW, ACTIVE → DELETED (삭제)</li>
 *   <li>불법 전이 → CORRUPTED (예외 대신 상태로 기록)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NEW (NotSelected)
 *    │
 *    ▼ (인프라 선택)
 * NEW (Selected)
 *    │
 *    ▼ (활성화)
 * ACTIVE
 *    │
 *    ▼ (삭제)
 * DELETED
 *
 * 어느 상태에서든 불법 이벤트 → CORRUPTED
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum AppStatus {

    /**
     * 생성됨 (아직 활성화 안 됨).
     */
    NEW,

    /**
     * 활성화됨.
     */
    ACTIVE,

    /**
     * 삭제됨.
     */
    DELETED,

    /**
     * 손상됨 (불법 이벤트 적용 결과, 관리자 복구 필요).
     */
    CORRUPTED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(DELETED, CORRUPTED)에서는 어떤 연산도 노출되지 않습니다.</p>
     *
     * @return DELETED 또는 CORRUPTED인 경우 true
     */
    public boolean isTerminal() {
        return this == DELETED || this == CORRUPTED;
    }
}
