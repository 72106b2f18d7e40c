package com.ryuqq.tripplan.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Receiver 내 엔티티 컬렉션 식별자.
 *
 * <p>컬렉션 이름과 엔티티 타입을 함께 보관하여 Receiver API를 타입 안전하게 만듭니다.</p>
 *
 * <pre>
 * Optional&lt;Flight&gt; flight = receiver.findById(EntityKind.FLIGHTS, 3L);
 * </pre>
 *
 * @param <E> 컬렉션에 저장되는 엔티티 타입
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class EntityKind<E extends Entity<E>> {

    public static final EntityKind<Trip> TRIPS = new EntityKind<>("trips", "trip", Trip.class, false);
    public static final EntityKind<Flight> FLIGHTS = new EntityKind<>("flights", "flight", Flight.class, true);
    public static final EntityKind<Hotel> HOTELS = new EntityKind<>("hotels", "hotel", Hotel.class, true);
    public static final EntityKind<Activity> ACTIVITIES = new EntityKind<>("activities", "activity", Activity.class, true);
    public static final EntityKind<Expense> EXPENSES = new EntityKind<>("expenses", "expense", Expense.class, true);

    private static final List<EntityKind<?>> VALUES = List.of(TRIPS, FLIGHTS, HOTELS, ACTIVITIES, EXPENSES);

    private final String collectionName;
    private final String singularName;
    private final Class<E> type;
    private final boolean itinerary;

    private EntityKind(String collectionName, String singularName, Class<E> type, boolean itinerary) {
        this.collectionName = collectionName;
        this.singularName = singularName;
        this.type = type;
        this.itinerary = itinerary;
    }

    /**
     * 정의된 모든 컬렉션.
     *
     * @return 불변 리스트
     */
    public static List<EntityKind<?>> values() {
        return VALUES;
    }

    /**
     * 단수형 이름("flight", "hotel" 등)으로 컬렉션 조회.
     *
     * @param singularName 단수형 이름 (대소문자 무시)
     * @return 컬렉션, 없으면 empty
     */
    public static Optional<EntityKind<?>> fromSingularName(String singularName) {
        if (singularName == null) {
            return Optional.empty();
        }
        String normalized = singularName.trim().toLowerCase(Locale.ROOT);
        return VALUES.stream()
            .filter(kind -> kind.singularName.equals(normalized))
            .findFirst();
    }

    public String collectionName() {
        return collectionName;
    }

    public String singularName() {
        return singularName;
    }

    public Class<E> type() {
        return type;
    }

    /**
     * 일정 항목 컬렉션인지 확인.
     *
     * @return Trip이 아닌 일정 항목 컬렉션이면 true
     */
    public boolean isItinerary() {
        return itinerary;
    }

    @Override
    public String toString() {
        return collectionName;
    }
}
