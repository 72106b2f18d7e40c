package com.ryuqq.tripplan.core.model;

/**
 * Receiver 컬렉션에 저장되는 엔티티.
 *
 * <p>모든 엔티티는 불변 record이며, 컬렉션 내에서 고유한 숫자 ID로 식별됩니다.
 * ID가 아직 할당되지 않은 초안(draft) 엔티티는 ID 0을 가집니다.</p>
 *
 * @param <E> 구현 타입 (self type)
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public interface Entity<E extends Entity<E>> {

    /**
     * ID가 할당되지 않은 초안 엔티티의 ID.
     */
    long UNASSIGNED_ID = 0L;

    /**
     * 엔티티 ID 조회.
     *
     * @return 컬렉션 내 고유 ID (초안이면 0)
     */
    long id();

    /**
     * ID만 변경한 새 인스턴스 생성.
     *
     * @param id 새 ID
     * @return 새 엔티티 인스턴스
     */
    E withId(long id);
}
