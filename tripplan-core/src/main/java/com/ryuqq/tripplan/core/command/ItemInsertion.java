package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.ItineraryItem;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;

import java.util.Optional;

/**
 * 일정 항목 추가 Command들이 공유하는 삽입/삭제 로직.
 *
 * <p>최초 실행 시 {@link Receiver#nextId(EntityKind)}로 ID를 먼저 할당받고,
 * 삽입된 항목 전체를 역연산 상태로 보관합니다. redo는 같은 항목을 같은 ID로 다시 삽입합니다.</p>
 *
 * @param <E> 일정 항목 타입
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
final class ItemInsertion<E extends ItineraryItem<E>> {

    private final Receiver receiver;
    private final EntityKind<E> kind;
    private final long tripId;

    private E insertedItem;

    ItemInsertion(Receiver receiver, EntityKind<E> kind, long tripId) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.receiver = receiver;
        this.kind = kind;
        this.tripId = tripId;
    }

    /**
     * 항목 삽입 (최초 실행 또는 redo).
     *
     * @param lifecycle Command 상태
     * @param draft ID 미할당 항목 (redo 시 무시됨)
     * @return 실행 결과
     */
    Outcome insert(CommandLifecycle lifecycle, E draft) {
        if (receiver.findById(EntityKind.TRIPS, tripId).isEmpty()) {
            return lifecycle.failed(Fail.notFound("Trip " + tripId + " not found"));
        }

        E item = insertedItem != null ? insertedItem : draft.withId(receiver.nextId(kind));
        Optional<E> stored = receiver.insertWithId(kind, item);
        if (stored.isEmpty()) {
            // 검사 이후 Trip이 삭제되었거나 ID가 이미 사용 중
            if (receiver.findById(EntityKind.TRIPS, tripId).isEmpty()) {
                return lifecycle.failed(Fail.notFound("Trip " + tripId + " not found"));
            }
            return lifecycle.failed(Fail.validation(
                kind.singularName() + " id " + item.id() + " is already in use"));
        }

        insertedItem = stored.get();
        return lifecycle.succeeded(insertedItem);
    }

    /**
     * 삽입한 항목 삭제 (undo).
     *
     * @param lifecycle Command 상태
     * @return undo 성공 여부
     */
    boolean remove(CommandLifecycle lifecycle) {
        if (receiver.delete(kind, insertedItem.id())) {
            return lifecycle.undone();
        }
        return lifecycle.undoFailed(Fail.inverseUnavailable(
            kind.singularName() + " " + insertedItem.id() + " no longer exists"));
    }

    Optional<E> insertedItem() {
        return Optional.ofNullable(insertedItem);
    }
}
