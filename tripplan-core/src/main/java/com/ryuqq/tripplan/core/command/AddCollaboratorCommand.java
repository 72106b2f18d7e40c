package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.model.Trip;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.time.Clock;
import java.util.Optional;

/**
 * Trip에 협업자 추가.
 *
 * <p>소유자나 이미 등록된 협업자는 추가할 수 없습니다 (VALIDATION_FAILURE).</p>
 *
 * <p><strong>undo:</strong> 이 Command가 추가한 사용자를 제거. 이미 외부에서 제거되었으면
 * INVERSE_UNAVAILABLE</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class AddCollaboratorCommand implements Command {

    private final Receiver receiver;
    private final long tripId;
    private final long userId;
    private final CommandLifecycle lifecycle;

    public AddCollaboratorCommand(Receiver receiver, Clock clock, long tripId, long userId) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        this.receiver = receiver;
        this.tripId = tripId;
        this.userId = userId;
        Payload payload = Payload.builder()
            .put("tripId", tripId)
            .put("userId", userId)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.ADD_COLLABORATOR, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        if (userId <= 0) {
            return lifecycle.failed(Fail.validation("userId must be positive (current: " + userId + ")"));
        }

        Optional<Trip> trip = receiver.findById(EntityKind.TRIPS, tripId);
        if (trip.isEmpty()) {
            return lifecycle.failed(Fail.notFound("Trip " + tripId + " not found"));
        }
        if (trip.get().isOwner(userId)) {
            return lifecycle.failed(Fail.validation("User " + userId + " owns trip " + tripId));
        }
        if (trip.get().hasCollaborator(userId)) {
            return lifecycle.failed(Fail.validation(
                "User " + userId + " is already a collaborator of trip " + tripId));
        }

        // 조회 이후 다른 요청이 먼저 추가했을 수 있음
        if (!receiver.addCollaborator(tripId, userId)) {
            return lifecycle.failed(Fail.validation(
                "User " + userId + " could not be added to trip " + tripId));
        }

        Trip updated = receiver.findById(EntityKind.TRIPS, tripId).orElse(trip.get().withCollaborator(userId));
        return lifecycle.succeeded(updated);
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> {
            if (receiver.removeCollaborator(tripId, userId)) {
                return lifecycle.undone();
            }
            return lifecycle.undoFailed(Fail.inverseUnavailable(
                "User " + userId + " is no longer a collaborator of trip " + tripId));
        });
    }

    @Override
    public CommandKind kind() {
        return CommandKind.ADD_COLLABORATOR;
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
