package com.ryuqq.tripplan.core.contract;

import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.time.Instant;

/**
 * Command 조회 결과 (읽기 전용 스냅샷).
 *
 * <p>히스토리 조회 API가 Command 자체 대신 반환하는 값으로,
 * 호출자가 Command 상태를 변경할 수 없도록 합니다.</p>
 *
 * @param kind Command 종류
 * @param status 현재 상태
 * @param executedAt 마지막 실행 시각 (null 가능)
 * @param undoneAt 마지막 undo 시각 (null 가능)
 * @param payload 입력 파라미터
 * @param error 마지막 오류 (null 가능)
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record CommandDescription(
    CommandKind kind,
    CommandStatus status,
    Instant executedAt,
    Instant undoneAt,
    Payload payload,
    Fail error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind, status, payload 중 하나가 null인 경우
     */
    public CommandDescription {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * 로그용 한 줄 요약.
     *
     * @return "CreateTrip[EXECUTED] {ownerId=1, ...}" 형식 문자열
     */
    public String summary() {
        StringBuilder sb = new StringBuilder()
            .append(kind.displayName())
            .append('[').append(status).append("] {")
            .append(payload.summary())
            .append('}');
        if (error != null) {
            sb.append(" error=").append(error.errorCode()).append(": ").append(error.message());
        }
        return sb.toString();
    }
}
