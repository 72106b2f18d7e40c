package com.ryuqq.tripplan.core.statemachine;

/**
 * Command의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → EXECUTED (최초 실행 성공)</li>
 *   <li>PENDING → FAILED (최초 실행 실패, 히스토리에 기록되지 않음)</li>
 *   <li>EXECUTED → UNDONE (undo 성공, undo 실패 시 EXECUTED 유지)</li>
 *   <li>UNDONE → EXECUTED (redo 성공)</li>
 *   <li>UNDONE → FAILED (redo 실패, 더 이상 되돌릴 수 없음)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► FAILED (실행 실패)
 *    │
 *    ▼ (실행 성공)
 * EXECUTED ◄──────┐
 *    │            │ (redo 성공)
 *    ▼ (undo)     │
 * UNDONE ─────────┘
 *    │
 *    └─► FAILED (redo 실패)
 *
 * 금지된 전이:
 * - FAILED → * ❌
 * - EXECUTED → PENDING, EXECUTED → FAILED ❌
 * - UNDONE → PENDING ❌
 * </pre>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public enum CommandStatus {

    /**
     * 생성됨 (아직 실행 안 됨).
     */
    PENDING,

    /**
     * 저장소에 적용됨 (undo 가능).
     */
    EXECUTED,

    /**
     * 되돌려짐 (redo 가능).
     */
    UNDONE,

    /**
     * 실패 (종료 상태).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>FAILED에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == FAILED;
    }

    /**
     * 실행(또는 재실행) 가능한 상태인지 확인.
     *
     * @return PENDING 또는 UNDONE인 경우 true
     */
    public boolean isExecutable() {
        return this == PENDING || this == UNDONE;
    }
}
