package com.ryuqq.tripplan.core.model;

import java.time.LocalDate;

/**
 * 숙박 일정 항목.
 *
 * @param id 항목 ID (초안이면 0)
 * @param tripId 소속 Trip ID
 * @param name 호텔 이름
 * @param checkin 체크인 날짜
 * @param checkout 체크아웃 날짜
 * @param done 완료 여부
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Hotel(
    long id,
    long tripId,
    String name,
    LocalDate checkin,
    LocalDate checkout,
    boolean done
) implements ItineraryItem<Hotel> {

    public static Hotel draft(long tripId, String name, LocalDate checkin, LocalDate checkout) {
        return new Hotel(UNASSIGNED_ID, tripId, name, checkin, checkout, false);
    }

    @Override
    public Hotel withId(long id) {
        return new Hotel(id, tripId, name, checkin, checkout, done);
    }

    @Override
    public Hotel withDone(boolean done) {
        return new Hotel(id, tripId, name, checkin, checkout, done);
    }
}
