package com.ryuqq.tripplan.core.outcome;

/**
 * 실패 결과.
 *
 * <p>검증 실패, 참조 대상 없음, 역연산 불가, 히스토리 소진 중 하나를 나타냅니다.
 * 어떤 경우든 저장소는 변경되지 않은 상태로 남습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>VALIDATION_FAILURE: 음수 예산, 이미 공동 작업자인 사용자</li>
 *   <li>NOT_FOUND: 존재하지 않는 Trip ID</li>
 *   <li>INVERSE_UNAVAILABLE: undo 대상 항목이 외부에서 삭제됨</li>
 *   <li>HISTORY_EXHAUSTED: 빈 히스토리에서 undo 호출</li>
 * </ul>
 *
 * @param errorCode 오류 분류
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Fail(
    ErrorCode errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode가 null이거나 message가 null/빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param errorCode 오류 분류
     * @param message 오류 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorCode errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 분류
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorCode errorCode, String message) {
        return new Fail(errorCode, message, null);
    }

    public static Fail validation(String message) {
        return new Fail(ErrorCode.VALIDATION_FAILURE, message, null);
    }

    public static Fail notFound(String message) {
        return new Fail(ErrorCode.NOT_FOUND, message, null);
    }

    public static Fail inverseUnavailable(String message) {
        return new Fail(ErrorCode.INVERSE_UNAVAILABLE, message, null);
    }

    public static Fail historyExhausted(String message) {
        return new Fail(ErrorCode.HISTORY_EXHAUSTED, message, null);
    }
}
