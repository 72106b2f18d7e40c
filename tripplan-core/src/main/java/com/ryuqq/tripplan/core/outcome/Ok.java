package com.ryuqq.tripplan.core.outcome;

import com.ryuqq.tripplan.core.model.Entity;

import java.util.Optional;

/**
 * 성공 결과.
 *
 * <p>Command가 저장소에 성공적으로 적용되었음을 나타냅니다.
 * execute/redo의 경우 변경된 엔티티의 최신 상태를 담고, undo의 경우 엔티티 없이 메시지만 담습니다.</p>
 *
 * @param entity 변경된 엔티티 (선택, null 가능)
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Ok(
    Entity<?> entity,
    String message
) implements Outcome {

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param entity 변경된 엔티티
     * @return Ok 인스턴스
     */
    public static Ok of(Entity<?> entity) {
        return new Ok(entity, null);
    }

    /**
     * 엔티티 없이 성공 결과 생성.
     *
     * @param message 성공 메시지
     * @return Ok 인스턴스
     */
    public static Ok message(String message) {
        return new Ok(null, message);
    }

    /**
     * 변경된 엔티티 조회.
     *
     * @return 엔티티, 없으면 empty
     */
    public Optional<Entity<?>> entityOptional() {
        return Optional.ofNullable(entity);
    }
}
