package com.ryuqq.tripplan.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 지출 일정 항목.
 *
 * <p>done 플래그는 정산 완료 여부로 사용됩니다.</p>
 *
 * @param id 항목 ID (초안이면 0)
 * @param tripId 소속 Trip ID
 * @param description 설명
 * @param amount 금액
 * @param currency 통화 코드 (예: BRL, USD)
 * @param date 지출일
 * @param category 분류 (예: food, transport)
 * @param done 정산 완료 여부
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Expense(
    long id,
    long tripId,
    String description,
    BigDecimal amount,
    String currency,
    LocalDate date,
    String category,
    boolean done
) implements ItineraryItem<Expense> {

    public static Expense draft(long tripId, String description, BigDecimal amount,
                                String currency, LocalDate date, String category) {
        return new Expense(UNASSIGNED_ID, tripId, description, amount, currency, date, category, false);
    }

    @Override
    public Expense withId(long id) {
        return new Expense(id, tripId, description, amount, currency, date, category, done);
    }

    @Override
    public Expense withDone(boolean done) {
        return new Expense(id, tripId, description, amount, currency, date, category, done);
    }
}
