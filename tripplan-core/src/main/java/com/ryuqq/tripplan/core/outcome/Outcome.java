package com.ryuqq.tripplan.core.outcome;

/**
 * Command 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 적용됨</li>
 *   <li>{@link Fail}: 실패, 저장소 변경 없음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 다른 구현을 허용하지 않습니다.
 * 실패는 예외가 아닌 값으로 반환되므로 호출자는 항상 결과를 확인해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = invoker.execute(command);
 * if (outcome instanceof Fail fail) {
 *     log.warn("{}: {}", fail.errorCode(), fail.message());
 * }
 * </pre>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
