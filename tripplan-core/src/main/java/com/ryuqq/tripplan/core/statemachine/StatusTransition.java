package com.ryuqq.tripplan.core.statemachine;

/**
 * Command 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Command의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → EXECUTED, PENDING → FAILED</li>
 *   <li>EXECUTED → UNDONE</li>
 *   <li>UNDONE → EXECUTED, UNDONE → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>PENDING으로의 전이 불가</li>
 * </ul>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CommandStatus from, CommandStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        // 허용된 전이만 통과
        boolean valid = switch (from) {
            case PENDING, UNDONE -> to == CommandStatus.EXECUTED || to == CommandStatus.FAILED;
            case EXECUTED -> to == CommandStatus.UNDONE;
            case FAILED -> false; // 종료 상태 (위에서 이미 체크)
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CommandStatus transition(CommandStatus current, CommandStatus next) {
        validate(current, next);
        return next;
    }
}
