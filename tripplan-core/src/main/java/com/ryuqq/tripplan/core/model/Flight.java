package com.ryuqq.tripplan.core.model;

import java.time.LocalDateTime;

/**
 * 항공편 일정 항목.
 *
 * @param id 항목 ID (초안이면 0)
 * @param tripId 소속 Trip ID
 * @param company 항공사
 * @param code 편명 (예: AA1)
 * @param departure 출발 시각
 * @param arrival 도착 시각
 * @param done 완료 여부
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Flight(
    long id,
    long tripId,
    String company,
    String code,
    LocalDateTime departure,
    LocalDateTime arrival,
    boolean done
) implements ItineraryItem<Flight> {

    public static Flight draft(long tripId, String company, String code,
                               LocalDateTime departure, LocalDateTime arrival) {
        return new Flight(UNASSIGNED_ID, tripId, company, code, departure, arrival, false);
    }

    @Override
    public Flight withId(long id) {
        return new Flight(id, tripId, company, code, departure, arrival, done);
    }

    @Override
    public Flight withDone(boolean done) {
        return new Flight(id, tripId, company, code, departure, arrival, done);
    }
}
