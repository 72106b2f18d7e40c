package com.ryuqq.tripplan.core.contract;

import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.util.Optional;

/**
 * 되돌릴 수 있는 단일 변경 작업.
 *
 * <p>Command는 하나의 Receiver와 생성 시 고정된 Payload에 바인딩되며,
 * 실행 중에 자신의 효과를 되돌리는 데 필요한 최소한의 상태(역연산 상태)를 캡처합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li><strong>execute():</strong> PENDING 또는 UNDONE 상태에서만 유효. 성공 시 EXECUTED,
 *       실패 시 FAILED로 전이하며 Receiver는 변경되지 않은 상태로 남음.
 *       UNDONE 상태에서의 호출이 redo이며, 실행 시점 검증을 다시 수행함</li>
 *   <li><strong>undo():</strong> EXECUTED 상태에서만 유효. 성공 시 UNDONE으로 전이.
 *       실패 시 상태는 EXECUTED로 유지되고 오류만 기록됨</li>
 *   <li><strong>describe():</strong> 부수 효과 없는 조회</li>
 * </ul>
 *
 * <p><strong>역연산 상태:</strong> 한 번이라도 EXECUTED에 도달한 Command만 가지며,
 * 이후 지워지지 않으므로 redo 이후에도 다시 undo할 수 있습니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> Command는 스레드 안전하지 않습니다.
 * Invoker가 자신의 히스토리에 대한 호출을 직렬화합니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public interface Command {

    /**
     * Command 종류.
     *
     * @return 종류 태그
     */
    CommandKind kind();

    /**
     * 현재 상태.
     *
     * @return 상태
     */
    CommandStatus status();

    /**
     * 생성 시 전달된 입력 파라미터.
     *
     * @return 불변 Payload
     */
    Payload payload();

    /**
     * 순방향 변경을 Receiver에 적용 (최초 실행 또는 redo).
     *
     * <p>실행 가능한 상태가 아니면 상태 변경 없이 VALIDATION_FAILURE를 반환합니다.</p>
     *
     * @return 성공 시 변경된 엔티티를 담은 Ok, 실패 시 Fail
     */
    Outcome execute();

    /**
     * 캡처한 역연산 상태로 변경을 되돌림.
     *
     * @return 성공 여부 (실패 사유는 {@link #error()})
     */
    boolean undo();

    /**
     * 읽기 전용 설명 생성.
     *
     * @return 현재 상태 스냅샷
     */
    CommandDescription describe();

    /**
     * 마지막 성공 실행 결과.
     *
     * @return 변경된 엔티티, 실행된 적 없으면 empty
     */
    Optional<Entity<?>> result();

    /**
     * 마지막 오류.
     *
     * <p>FAILED 상태이거나 마지막 undo가 실패한 경우에만 존재합니다.</p>
     *
     * @return 오류, 없으면 empty
     */
    Optional<Fail> error();

    /**
     * undo 가능한지 확인.
     *
     * @return EXECUTED 상태이면 true
     */
    default boolean canUndo() {
        return status() == CommandStatus.EXECUTED;
    }

    /**
     * redo 가능한지 확인.
     *
     * @return UNDONE 상태이면 true
     */
    default boolean canRedo() {
        return status() == CommandStatus.UNDONE;
    }
}
