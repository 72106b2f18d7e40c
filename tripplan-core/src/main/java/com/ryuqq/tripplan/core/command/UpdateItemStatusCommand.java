package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.ItineraryItem;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 일정 항목의 완료 여부 변경.
 *
 * <p><strong>역연산 상태:</strong> 변경 직전 완료 여부</p>
 * <p><strong>undo:</strong> 현재 값이 이 Command가 기록한 값과 같을 때만 복원</p>
 *
 * @param <E> 일정 항목 타입 (Flight, Hotel, Activity, Expense)
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class UpdateItemStatusCommand<E extends ItineraryItem<E>> implements Command {

    private final Receiver receiver;
    private final EntityKind<E> itemKind;
    private final long itemId;
    private final boolean done;
    private final CommandLifecycle lifecycle;

    private Boolean previousDone;

    /**
     * 생성자.
     *
     * @param receiver 대상 저장소
     * @param clock 타임스탬프용 시계
     * @param itemKind 일정 항목 컬렉션
     * @param itemId 항목 ID
     * @param done 설정할 완료 여부
     * @throws IllegalArgumentException receiver 또는 itemKind가 null인 경우
     */
    public UpdateItemStatusCommand(Receiver receiver, Clock clock, EntityKind<E> itemKind, long itemId, boolean done) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (itemKind == null) {
            throw new IllegalArgumentException("itemKind cannot be null");
        }
        this.receiver = receiver;
        this.itemKind = itemKind;
        this.itemId = itemId;
        this.done = done;
        Payload payload = Payload.builder()
            .put("itemType", itemKind.singularName())
            .put("itemId", itemId)
            .put("done", done)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.UPDATE_ITEM_STATUS, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        AtomicBoolean captured = new AtomicBoolean();
        Optional<E> updated = receiver.update(itemKind, itemId, item -> {
            captured.set(item.done());
            return item.withDone(done);
        });
        if (updated.isEmpty()) {
            return lifecycle.failed(Fail.notFound(itemKind.singularName() + " " + itemId + " not found"));
        }

        previousDone = captured.get();
        return lifecycle.succeeded(updated.get());
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> {
            AtomicBoolean unchanged = new AtomicBoolean(true);
            Optional<E> restored = receiver.update(itemKind, itemId, item -> {
                if (item.done() != done) {
                    unchanged.set(false);
                    return item;
                }
                return item.withDone(previousDone);
            });
            if (restored.isEmpty()) {
                return lifecycle.undoFailed(Fail.inverseUnavailable(
                    itemKind.singularName() + " " + itemId + " no longer exists"));
            }
            if (!unchanged.get()) {
                return lifecycle.undoFailed(Fail.inverseUnavailable(
                    "Status of " + itemKind.singularName() + " " + itemId + " was changed externally"));
            }
            return lifecycle.undone();
        });
    }

    public EntityKind<E> itemKind() {
        return itemKind;
    }

    public Optional<Boolean> previousDone() {
        return Optional.ofNullable(previousDone);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.UPDATE_ITEM_STATUS;
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
