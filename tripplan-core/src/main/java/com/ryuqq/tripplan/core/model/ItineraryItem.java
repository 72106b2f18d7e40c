package com.ryuqq.tripplan.core.model;

/**
 * 여행 일정 항목 (항공편, 호텔, 액티비티, 지출).
 *
 * <p>모든 일정 항목은 하나의 Trip에 속하며, 완료 여부(done) 플래그를 가집니다.</p>
 *
 * @param <E> 구현 타입 (self type)
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public interface ItineraryItem<E extends ItineraryItem<E>> extends Entity<E> {

    /**
     * 소속 Trip ID.
     *
     * @return Trip ID
     */
    long tripId();

    /**
     * 완료 여부.
     *
     * @return 완료되었으면 true
     */
    boolean done();

    /**
     * 완료 여부만 변경한 새 인스턴스 생성.
     *
     * @param done 새 완료 여부
     * @return 새 항목 인스턴스
     */
    E withDone(boolean done);
}
