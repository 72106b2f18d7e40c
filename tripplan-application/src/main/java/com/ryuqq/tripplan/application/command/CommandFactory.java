package com.ryuqq.tripplan.application.command;

import com.ryuqq.tripplan.core.command.AddActivityCommand;
import com.ryuqq.tripplan.core.command.AddCollaboratorCommand;
import com.ryuqq.tripplan.core.command.AddExpenseCommand;
import com.ryuqq.tripplan.core.command.AddFlightCommand;
import com.ryuqq.tripplan.core.command.AddHotelCommand;
import com.ryuqq.tripplan.core.command.CreateTripCommand;
import com.ryuqq.tripplan.core.command.ShareCodeGenerator;
import com.ryuqq.tripplan.core.command.UpdateBudgetCommand;
import com.ryuqq.tripplan.core.command.UpdateItemStatusCommand;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.ItineraryItem;
import com.ryuqq.tripplan.core.spi.Receiver;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 하나의 Receiver에 바인딩된 Command 생성기.
 *
 * <p>모든 Command가 같은 Receiver, Clock, 공유 코드 생성기를 사용하도록 보장합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandFactory factory = new CommandFactory(receiver);
 * invoker.execute(factory.createTrip(1L, "Lisbon", "Spring break",
 *     LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 7), null));
 * invoker.execute(factory.updateItemStatus("flight", flightId, true));
 * </pre>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class CommandFactory {

    private final Receiver receiver;
    private final Clock clock;
    private final ShareCodeGenerator shareCodeGenerator;

    /**
     * 시스템 UTC 시계와 무작위 공유 코드 생성기로 생성.
     *
     * @param receiver 대상 저장소
     */
    public CommandFactory(Receiver receiver) {
        this(receiver, Clock.systemUTC(), ShareCodeGenerator.random());
    }

    /**
     * 생성자.
     *
     * @param receiver 대상 저장소
     * @param clock 타임스탬프용 시계
     * @param shareCodeGenerator 공유 코드 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CommandFactory(Receiver receiver, Clock clock, ShareCodeGenerator shareCodeGenerator) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (shareCodeGenerator == null) {
            throw new IllegalArgumentException("shareCodeGenerator cannot be null");
        }
        this.receiver = receiver;
        this.clock = clock;
        this.shareCodeGenerator = shareCodeGenerator;
    }

    public CreateTripCommand createTrip(long ownerId, String destination, String name,
                                        LocalDate startDate, LocalDate endDate, String shareCode) {
        return new CreateTripCommand(receiver, clock, shareCodeGenerator,
            ownerId, destination, name, startDate, endDate, shareCode);
    }

    public UpdateBudgetCommand updateBudget(long tripId, BigDecimal newBudget) {
        return new UpdateBudgetCommand(receiver, clock, tripId, newBudget);
    }

    public AddCollaboratorCommand addCollaborator(long tripId, long userId) {
        return new AddCollaboratorCommand(receiver, clock, tripId, userId);
    }

    public AddFlightCommand addFlight(long tripId, String company, String code,
                                      LocalDateTime departure, LocalDateTime arrival) {
        return new AddFlightCommand(receiver, clock, tripId, company, code, departure, arrival);
    }

    public AddHotelCommand addHotel(long tripId, String name, LocalDate checkin, LocalDate checkout) {
        return new AddHotelCommand(receiver, clock, tripId, name, checkin, checkout);
    }

    public AddActivityCommand addActivity(long tripId, String description, LocalDate date) {
        return new AddActivityCommand(receiver, clock, tripId, description, date);
    }

    public AddExpenseCommand addExpense(long tripId, String description, BigDecimal amount,
                                        String currency, LocalDate date, String category) {
        return new AddExpenseCommand(receiver, clock, tripId, description, amount, currency, date, category);
    }

    /**
     * 일정 항목 완료 여부 변경 Command 생성.
     *
     * @param itemKind 일정 항목 컬렉션 (FLIGHTS, HOTELS, ACTIVITIES, EXPENSES)
     * @param itemId 항목 ID
     * @param done 설정할 완료 여부
     * @param <E> 일정 항목 타입
     * @return Command
     * @throws IllegalArgumentException itemKind가 null인 경우
     */
    public <E extends ItineraryItem<E>> UpdateItemStatusCommand<E> updateItemStatus(
            EntityKind<E> itemKind, long itemId, boolean done) {
        return new UpdateItemStatusCommand<>(receiver, clock, itemKind, itemId, done);
    }

    /**
     * 항목 타입 이름으로 완료 여부 변경 Command 생성.
     *
     * @param itemType "flight", "hotel", "activity", "expense" 중 하나
     * @param itemId 항목 ID
     * @param done 설정할 완료 여부
     * @return Command
     * @throws IllegalArgumentException 알 수 없거나 일정 항목이 아닌 타입인 경우
     */
    public UpdateItemStatusCommand<?> updateItemStatus(String itemType, long itemId, boolean done) {
        EntityKind<?> kind = EntityKind.fromSingularName(itemType)
            .filter(EntityKind::isItinerary)
            .orElseThrow(() -> new IllegalArgumentException("Unknown item type: " + itemType));
        if (kind == EntityKind.FLIGHTS) {
            return updateItemStatus(EntityKind.FLIGHTS, itemId, done);
        }
        if (kind == EntityKind.HOTELS) {
            return updateItemStatus(EntityKind.HOTELS, itemId, done);
        }
        if (kind == EntityKind.ACTIVITIES) {
            return updateItemStatus(EntityKind.ACTIVITIES, itemId, done);
        }
        if (kind == EntityKind.EXPENSES) {
            return updateItemStatus(EntityKind.EXPENSES, itemId, done);
        }
        throw new IllegalArgumentException("Unknown item type: " + itemType);
    }

    public Receiver receiver() {
        return receiver;
    }
}
