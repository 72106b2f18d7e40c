package com.ryuqq.tripplan.core.model;

import java.time.LocalDate;

/**
 * 액티비티 일정 항목.
 *
 * @param id 항목 ID (초안이면 0)
 * @param tripId 소속 Trip ID
 * @param description 설명
 * @param date 날짜
 * @param done 완료 여부
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Activity(
    long id,
    long tripId,
    String description,
    LocalDate date,
    boolean done
) implements ItineraryItem<Activity> {

    public static Activity draft(long tripId, String description, LocalDate date) {
        return new Activity(UNASSIGNED_ID, tripId, description, date, false);
    }

    @Override
    public Activity withId(long id) {
        return new Activity(id, tripId, description, date, done);
    }

    @Override
    public Activity withDone(boolean done) {
        return new Activity(id, tripId, description, date, done);
    }
}
