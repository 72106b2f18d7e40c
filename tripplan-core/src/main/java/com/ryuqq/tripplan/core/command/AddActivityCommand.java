package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Activity;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Trip 일정에 활동 추가.
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class AddActivityCommand implements Command {

    private final String description;
    private final LocalDate date;
    private final long tripId;
    private final ItemInsertion<Activity> insertion;
    private final CommandLifecycle lifecycle;

    public AddActivityCommand(Receiver receiver, Clock clock, long tripId, String description, LocalDate date) {
        this.insertion = new ItemInsertion<>(receiver, EntityKind.ACTIVITIES, tripId);
        this.tripId = tripId;
        this.description = description;
        this.date = date;
        Payload payload = Payload.builder()
            .put("tripId", tripId)
            .put("description", description)
            .put("date", date)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.ADD_ACTIVITY, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        Optional<Fail> missing = new RequiredFields("activity")
            .text("description", description)
            .value("date", date)
            .check();
        if (missing.isPresent()) {
            return lifecycle.failed(missing.get());
        }
        return insertion.insert(lifecycle, Activity.draft(tripId, description, date));
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> insertion.remove(lifecycle));
    }

    public Optional<Activity> insertedActivity() {
        return insertion.insertedItem();
    }

    @Override
    public CommandKind kind() {
        return CommandKind.ADD_ACTIVITY;
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
