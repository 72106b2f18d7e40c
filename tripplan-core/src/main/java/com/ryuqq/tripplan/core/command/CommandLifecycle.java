package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.ErrorCode;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Ok;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;
import com.ryuqq.tripplan.core.statemachine.StatusTransition;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Command 공통 상태 (상태, 타임스탬프, 결과, 오류).
 *
 * <p>각 Command 구현은 이 객체를 필드로 보유하고 상태 전이를 위임합니다.
 * 모든 전이는 {@link StatusTransition}으로 검증됩니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
final class CommandLifecycle {

    private final CommandKind kind;
    private Payload payload;
    private final Clock clock;

    private CommandStatus status = CommandStatus.PENDING;
    private Instant executedAt;
    private Instant undoneAt;
    private Entity<?> result;
    private Fail error;

    CommandLifecycle(CommandKind kind, Payload payload, Clock clock) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.kind = kind;
        this.payload = payload;
        this.clock = clock;
    }

    /**
     * 순방향 실행 본문을 감싸 실행.
     *
     * <p>실행 불가능한 상태면 상태 변경 없이 거부하고,
     * Receiver가 예외를 던지면 RECEIVER_FAILURE로 실패 처리합니다.</p>
     *
     * @param body 실행 본문 (succeeded/failed 중 하나를 호출해야 함)
     * @return 실행 결과
     */
    Outcome execute(Supplier<Outcome> body) {
        if (!status.isExecutable()) {
            return Fail.validation(kind.displayName() + " cannot be executed in status " + status);
        }
        try {
            return body.get();
        } catch (RuntimeException e) {
            return failed(Fail.of(ErrorCode.RECEIVER_FAILURE,
                kind.displayName() + " failed in receiver", e.toString()));
        }
    }

    /**
     * undo 본문을 감싸 실행.
     *
     * <p>EXECUTED 상태가 아니면 아무것도 하지 않고 false를 반환합니다.</p>
     *
     * @param body undo 본문 (undone/undoFailed 중 하나를 호출해야 함)
     * @return undo 성공 여부
     */
    boolean undo(BooleanSupplier body) {
        if (status != CommandStatus.EXECUTED) {
            return false;
        }
        try {
            return body.getAsBoolean();
        } catch (RuntimeException e) {
            return undoFailed(Fail.of(ErrorCode.RECEIVER_FAILURE,
                kind.displayName() + " undo failed in receiver", e.toString()));
        }
    }

    Ok succeeded(Entity<?> entity) {
        status = StatusTransition.transition(status, CommandStatus.EXECUTED);
        executedAt = clock.instant();
        result = entity;
        error = null;
        return Ok.of(entity);
    }

    Fail failed(Fail fail) {
        status = StatusTransition.transition(status, CommandStatus.FAILED);
        error = fail;
        return fail;
    }

    boolean undone() {
        status = StatusTransition.transition(status, CommandStatus.UNDONE);
        undoneAt = clock.instant();
        error = null;
        return true;
    }

    boolean undoFailed(Fail fail) {
        error = fail;
        return false;
    }

    CommandStatus status() {
        return status;
    }

    boolean isRedo() {
        return status == CommandStatus.UNDONE;
    }

    /**
     * 실행 중 확정된 입력값(생성된 공유 코드 등)으로 Payload 교체.
     *
     * @param resolved 확정된 Payload
     * @throws IllegalArgumentException resolved가 null인 경우
     */
    void resolvePayload(Payload resolved) {
        if (resolved == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        this.payload = resolved;
    }

    Optional<Entity<?>> result() {
        return Optional.ofNullable(result);
    }

    Optional<Fail> error() {
        return Optional.ofNullable(error);
    }

    CommandDescription describe() {
        return new CommandDescription(kind, status, executedAt, undoneAt, payload, error);
    }
}
