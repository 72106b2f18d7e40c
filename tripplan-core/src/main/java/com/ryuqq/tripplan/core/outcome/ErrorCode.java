package com.ryuqq.tripplan.core.outcome;

/**
 * 실패 분류.
 *
 * <p><strong>발생 위치:</strong></p>
 * <ul>
 *   <li>VALIDATION_FAILURE, NOT_FOUND: Command.execute() (변경 전 검증 실패)</li>
 *   <li>INVERSE_UNAVAILABLE: Command.undo() 또는 redo (저장소 상태가 캡처한 상태와 불일치)</li>
 *   <li>HISTORY_EXHAUSTED: Invoker 수준 (undo/redo할 항목 없음, Command와 무관)</li>
 *   <li>RECEIVER_FAILURE: Receiver 구현이 예외를 던진 경우 (예: 영속화 I/O 오류)</li>
 * </ul>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 비즈니스 규칙 위반 (음수 예산, 중복 공유 코드, 이미 공동 작업자 등).
     */
    VALIDATION_FAILURE,

    /**
     * 참조한 Trip 또는 일정 항목이 존재하지 않음.
     */
    NOT_FOUND,

    /**
     * 캡처한 역연산 상태가 저장소 상태와 맞지 않아 되돌릴 수 없음.
     */
    INVERSE_UNAVAILABLE,

    /**
     * undo/redo할 항목이 없음.
     */
    HISTORY_EXHAUSTED,

    /**
     * Receiver 호출 중 예기치 않은 예외 발생.
     */
    RECEIVER_FAILURE
}
