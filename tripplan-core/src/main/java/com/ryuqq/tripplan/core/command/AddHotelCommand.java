package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Hotel;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Trip 일정에 숙소 추가.
 *
 * <p>체크아웃은 체크인보다 앞설 수 없습니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class AddHotelCommand implements Command {

    private final String name;
    private final LocalDate checkin;
    private final LocalDate checkout;
    private final long tripId;
    private final ItemInsertion<Hotel> insertion;
    private final CommandLifecycle lifecycle;

    public AddHotelCommand(Receiver receiver, Clock clock, long tripId, String name,
                           LocalDate checkin, LocalDate checkout) {
        this.insertion = new ItemInsertion<>(receiver, EntityKind.HOTELS, tripId);
        this.tripId = tripId;
        this.name = name;
        this.checkin = checkin;
        this.checkout = checkout;
        Payload payload = Payload.builder()
            .put("tripId", tripId)
            .put("name", name)
            .put("checkin", checkin)
            .put("checkout", checkout)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.ADD_HOTEL, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        Optional<Fail> missing = new RequiredFields("hotel")
            .text("name", name)
            .value("checkin", checkin)
            .value("checkout", checkout)
            .check();
        if (missing.isPresent()) {
            return lifecycle.failed(missing.get());
        }
        if (checkout.isBefore(checkin)) {
            return lifecycle.failed(Fail.validation(
                "Hotel checkout " + checkout + " cannot be before checkin " + checkin));
        }
        return insertion.insert(lifecycle, Hotel.draft(tripId, name, checkin, checkout));
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> insertion.remove(lifecycle));
    }

    public Optional<Hotel> insertedHotel() {
        return insertion.insertedItem();
    }

    @Override
    public CommandKind kind() {
        return CommandKind.ADD_HOTEL;
    }

    @Override
    public CommandStatus status() {
        return lifecycle.status();
    }

    @Override
    public Payload payload() {
        return lifecycle.describe().payload();
    }

    @Override
    public CommandDescription describe() {
        return lifecycle.describe();
    }

    @Override
    public Optional<Entity<?>> result() {
        return lifecycle.result();
    }

    @Override
    public Optional<Fail> error() {
        return lifecycle.error();
    }
}
