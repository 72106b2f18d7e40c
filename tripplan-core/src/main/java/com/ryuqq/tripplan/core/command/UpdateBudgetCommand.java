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

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Trip 예산 변경.
 *
 * <p>이전 예산 캡처와 새 예산 기록은 {@link Receiver#update}의 mutator 안에서 한 번에 수행되므로
 * 다른 스레드의 변경과 섞이지 않습니다.</p>
 *
 * <p><strong>역연산 상태:</strong> 변경 직전 예산</p>
 * <p><strong>undo:</strong> 현재 예산이 이 Command가 기록한 값과 같을 때만 이전 예산으로 복원.
 * 외부에서 예산이 바뀌었거나 Trip이 삭제되었으면 INVERSE_UNAVAILABLE</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class UpdateBudgetCommand implements Command {

    private final Receiver receiver;
    private final long tripId;
    private final BigDecimal newBudget;
    private final CommandLifecycle lifecycle;

    private BigDecimal previousBudget;

    public UpdateBudgetCommand(Receiver receiver, Clock clock, long tripId, BigDecimal newBudget) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        this.receiver = receiver;
        this.tripId = tripId;
        this.newBudget = newBudget;
        Payload payload = Payload.builder()
            .put("tripId", tripId)
            .put("newBudget", newBudget)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.UPDATE_BUDGET, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        if (newBudget == null) {
            return lifecycle.failed(Fail.validation("Missing required budget fields: newBudget"));
        }
        if (newBudget.signum() < 0) {
            return lifecycle.failed(Fail.validation("Budget cannot be negative (current: " + newBudget + ")"));
        }

        AtomicReference<BigDecimal> captured = new AtomicReference<>();
        Optional<Trip> updated = receiver.update(EntityKind.TRIPS, tripId, trip -> {
            captured.set(trip.budget());
            return trip.withBudget(newBudget);
        });
        if (updated.isEmpty()) {
            return lifecycle.failed(Fail.notFound("Trip " + tripId + " not found"));
        }

        previousBudget = captured.get();
        return lifecycle.succeeded(updated.get());
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> {
            AtomicBoolean unchanged = new AtomicBoolean(true);
            Optional<Trip> restored = receiver.update(EntityKind.TRIPS, tripId, trip -> {
                if (trip.budget().compareTo(newBudget) != 0) {
                    unchanged.set(false);
                    return trip;
                }
                return trip.withBudget(previousBudget);
            });
            if (restored.isEmpty()) {
                return lifecycle.undoFailed(Fail.inverseUnavailable("Trip " + tripId + " no longer exists"));
            }
            if (!unchanged.get()) {
                return lifecycle.undoFailed(Fail.inverseUnavailable(
                    "Budget of trip " + tripId + " was changed externally (expected "
                        + newBudget + ", found " + restored.get().budget() + ")"));
            }
            return lifecycle.undone();
        });
    }

    /**
     * 변경 직전 예산 (역연산 상태).
     *
     * @return 이전 예산, 실행된 적 없으면 empty
     */
    public Optional<BigDecimal> previousBudget() {
        return Optional.ofNullable(previousBudget);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.UPDATE_BUDGET;
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
