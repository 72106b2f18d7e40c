package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Flight;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Trip 일정에 항공편 추가.
 *
 * <p>도착 시각은 출발 시각보다 앞설 수 없습니다.
 * undo는 추가한 항공편을 삭제하고, redo는 같은 ID로 다시 삽입합니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class AddFlightCommand implements Command {

    private final String company;
    private final String code;
    private final LocalDateTime departure;
    private final LocalDateTime arrival;
    private final long tripId;
    private final ItemInsertion<Flight> insertion;
    private final CommandLifecycle lifecycle;

    public AddFlightCommand(Receiver receiver, Clock clock, long tripId, String company, String code,
                            LocalDateTime departure, LocalDateTime arrival) {
        this.insertion = new ItemInsertion<>(receiver, EntityKind.FLIGHTS, tripId);
        this.tripId = tripId;
        this.company = company;
        this.code = code;
        this.departure = departure;
        this.arrival = arrival;
        Payload payload = Payload.builder()
            .put("tripId", tripId)
            .put("company", company)
            .put("code", code)
            .put("departure", departure)
            .put("arrival", arrival)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.ADD_FLIGHT, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        Optional<Fail> missing = new RequiredFields("flight")
            .text("company", company)
            .text("code", code)
            .value("departure", departure)
            .value("arrival", arrival)
            .check();
        if (missing.isPresent()) {
            return lifecycle.failed(missing.get());
        }
        if (arrival.isBefore(departure)) {
            return lifecycle.failed(Fail.validation(
                "Flight arrival " + arrival + " cannot be before departure " + departure));
        }
        return insertion.insert(lifecycle, Flight.draft(tripId, company, code, departure, arrival));
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> insertion.remove(lifecycle));
    }

    public Optional<Flight> insertedFlight() {
        return insertion.insertedItem();
    }

    @Override
    public CommandKind kind() {
        return CommandKind.ADD_FLIGHT;
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
