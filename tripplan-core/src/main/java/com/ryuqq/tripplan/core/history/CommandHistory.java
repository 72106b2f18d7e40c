package com.ryuqq.tripplan.core.history;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 크기가 제한된 선형 Command 이력과 커서.
 *
 * <p>링 버퍼로 구현되어 가장 오래된 항목 제거가 O(1)입니다.
 * 논리 인덱스 0은 항상 가장 오래된 항목입니다.</p>
 *
 * <p>버퍼는 작게 시작해 maxSize까지 두 배씩 늘어나므로, 큰 maxSize를 설정해도
 * 실제로 보관한 항목 수만큼만 메모리를 사용합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code -1 <= cursor < size}</li>
 *   <li>{@code size <= maxSize}</li>
 *   <li>{@code [0..cursor]}는 적용된 항목, {@code (cursor..size)}는 redo 후보</li>
 *   <li>새 항목은 redo 후보가 모두 제거된 뒤에만 추가됨 (분기 없음)</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 동기화하지 않습니다. 호출자(Invoker)가 단일 임계 구역으로 보호해야 합니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class CommandHistory {

    static final int INITIAL_CAPACITY = 16;

    private final int maxSize;
    private Command[] slots;
    private int head;
    private int size;
    private int cursor = -1;

    /**
     * 생성자.
     *
     * @param config 이력 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public CommandHistory(HistoryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.maxSize = config.maxSize();
        this.slots = new Command[Math.min(maxSize, INITIAL_CAPACITY)];
    }

    public int size() {
        return size;
    }

    /**
     * 마지막으로 적용된 항목의 논리 인덱스.
     *
     * @return 커서 (-1이면 적용된 항목 없음)
     */
    public int cursor() {
        return cursor;
    }

    public int maxSize() {
        return maxSize;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 커서 위치 항목이 EXECUTED 상태인지 확인.
     *
     * @return undo 가능 여부
     */
    public boolean canUndo() {
        return cursor >= 0 && get(cursor).status() == CommandStatus.EXECUTED;
    }

    /**
     * 커서 다음 항목이 UNDONE 상태인지 확인.
     *
     * <p>redo에 실패해 FAILED가 된 항목은 이후 redo를 막습니다.</p>
     *
     * @return redo 가능 여부
     */
    public boolean canRedo() {
        return hasNext() && get(cursor + 1).status() == CommandStatus.UNDONE;
    }

    public boolean hasNext() {
        return cursor < size - 1;
    }

    /**
     * 커서 위치 항목 (undo 대상).
     *
     * @return 커서 위치 Command, 커서가 -1이면 empty
     */
    public Optional<Command> current() {
        return cursor >= 0 ? Optional.of(get(cursor)) : Optional.empty();
    }

    /**
     * 커서 다음 항목 (redo 대상).
     *
     * @return 커서 다음 Command, 없으면 empty
     */
    public Optional<Command> next() {
        return hasNext() ? Optional.of(get(cursor + 1)) : Optional.empty();
    }

    /**
     * 커서 이후 항목 모두 제거.
     *
     * @return 제거된 Command 목록 (오래된 순)
     */
    public List<Command> pruneRedoBranch() {
        if (!hasNext()) {
            return Collections.emptyList();
        }
        List<Command> discarded = new ArrayList<>(size - cursor - 1);
        for (int i = cursor + 1; i < size; i++) {
            discarded.add(get(i));
            slots[physical(i)] = null;
        }
        size = cursor + 1;
        return discarded;
    }

    /**
     * 항목 추가 후 커서를 마지막 항목으로 이동.
     *
     * <p>가득 차 있으면 가장 오래된 항목을 제거하고, 남은 항목의 상대 위치가 유지되도록 커서를 보정합니다.</p>
     *
     * @param command 추가할 Command (EXECUTED 상태)
     * @return 제거된 가장 오래된 Command, 없으면 empty
     * @throws IllegalArgumentException command가 null인 경우
     * @throws IllegalStateException redo 후보가 남아 있는 경우
     */
    public Optional<Command> append(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (hasNext()) {
            throw new IllegalStateException(
                "Redo branch must be pruned before append (cursor: " + cursor + ", size: " + size + ")");
        }

        Command evicted = null;
        if (size == slots.length && slots.length < maxSize) {
            grow();
        }
        if (size == maxSize) {
            evicted = slots[head];
            slots[head] = null;
            head = (head + 1) % slots.length;
            size--;
            cursor--;
        }

        slots[physical(size)] = command;
        size++;
        cursor = size - 1;
        return Optional.ofNullable(evicted);
    }

    /**
     * undo 성공 후 커서를 한 칸 뒤로 이동.
     *
     * @throws IllegalStateException 커서가 이미 -1인 경우
     */
    public void stepBack() {
        if (cursor < 0) {
            throw new IllegalStateException("Cursor is already before the first entry");
        }
        cursor--;
    }

    /**
     * redo 성공 후 커서를 한 칸 앞으로 이동.
     *
     * @throws IllegalStateException 커서가 이미 마지막 항목인 경우
     */
    public void stepForward() {
        if (!hasNext()) {
            throw new IllegalStateException("Cursor is already at the last entry");
        }
        cursor++;
    }

    /**
     * 전체 항목 조회 (오래된 순).
     *
     * @return 불변 스냅샷
     */
    public List<Command> entries() {
        return entries(0, size);
    }

    /**
     * 구간 조회 ({@code [from, to)}).
     *
     * <p>범위를 벗어난 인덱스는 {@code [0, size]}로 보정되며, from이 to보다 크면 빈 목록을 반환합니다.</p>
     *
     * @param from 시작 인덱스 (포함)
     * @param to 끝 인덱스 (제외)
     * @return 불변 스냅샷
     */
    public List<Command> entries(int from, int to) {
        int start = Math.max(0, Math.min(from, size));
        int end = Math.max(start, Math.min(to, size));
        List<Command> result = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            result.add(get(i));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 모든 항목 제거 및 커서 초기화.
     */
    public void clear() {
        for (int i = 0; i < size; i++) {
            slots[physical(i)] = null;
        }
        head = 0;
        size = 0;
        cursor = -1;
    }

    private Command get(int index) {
        return slots[physical(index)];
    }

    private int physical(int index) {
        return (int) (((long) head + index) % slots.length);
    }

    private void grow() {
        int capacity = (int) Math.min((long) slots.length * 2, maxSize);
        Command[] grown = new Command[capacity];
        for (int i = 0; i < size; i++) {
            grown[i] = get(i);
        }
        slots = grown;
        head = 0;
    }
}
