package com.ryuqq.tripplan.application.invoker;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.history.CommandHistory;
import com.ryuqq.tripplan.core.history.HistoryConfig;
import com.ryuqq.tripplan.core.outcome.ErrorCode;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Ok;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CommandHistory} 기반 Invoker 구현체.
 *
 * <p>모든 public 메서드는 이 인스턴스를 모니터로 동기화되어 커서와 이력을 읽고 쓰는 구간이
 * 하나의 임계 구역으로 직렬화됩니다. 여러 Invoker가 같은 Receiver를 공유하는 경우의 엔티티 격리는
 * Receiver 자체 잠금이 담당합니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>execute 실패: Command의 Fail을 그대로 반환, 이력에 추가하지 않음</li>
 *   <li>undo/redo 실패: INVERSE_UNAVAILABLE Fail 반환, 커서 유지</li>
 *   <li>이력 없음: HISTORY_EXHAUSTED Fail 반환, Command를 건드리지 않음</li>
 * </ul>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class HistoryCommandInvoker implements CommandInvoker {

    private static final Logger log = LoggerFactory.getLogger(HistoryCommandInvoker.class);

    private final CommandHistory history;

    /**
     * 기본 설정(maxSize=100)으로 생성.
     */
    public HistoryCommandInvoker() {
        this(new HistoryConfig());
    }

    /**
     * 생성자.
     *
     * @param config 이력 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public HistoryCommandInvoker(HistoryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.history = new CommandHistory(config);
    }

    @Override
    public synchronized Outcome execute(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (command.status() != CommandStatus.PENDING) {
            log.warn("Rejected {} submitted in status {}", command.kind().displayName(), command.status());
            return Fail.validation("Only pending commands can be submitted (current: " + command.status() + ")");
        }

        // 1. 커서 이후 redo 후보 제거
        List<Command> discarded = history.pruneRedoBranch();
        if (!discarded.isEmpty()) {
            log.info("Discarded {} redo entries before {}", discarded.size(), command.kind().displayName());
        }

        // 2. 실행
        Outcome outcome = command.execute();
        if (outcome instanceof Fail fail) {
            if (fail.errorCode() == ErrorCode.RECEIVER_FAILURE) {
                log.warn("{} failed in receiver: {}", command.kind().displayName(), fail.cause());
            } else {
                log.debug("{} rejected: {} ({})", command.kind().displayName(), fail.message(), fail.errorCode());
            }
            return outcome;
        }

        // 3. 이력 추가 (가득 차면 가장 오래된 항목 제거)
        Optional<Command> evicted = history.append(command);
        evicted.ifPresent(oldest ->
            log.info("History full (maxSize: {}), evicted oldest {}", history.maxSize(), oldest.kind().displayName()));

        log.debug("Executed {} [{}] (cursor: {})",
            command.kind().displayName(), command.payload().summary(), history.cursor());
        return outcome;
    }

    @Override
    public boolean undo() {
        return tryUndo().isOk();
    }

    @Override
    public boolean redo() {
        return tryRedo().isOk();
    }

    @Override
    public synchronized Outcome tryUndo() {
        Optional<Command> current = history.current();
        if (current.isEmpty()) {
            return Fail.historyExhausted("Nothing to undo");
        }

        Command command = current.get();
        if (command.status() != CommandStatus.EXECUTED) {
            return Fail.inverseUnavailable(
                command.kind().displayName() + " cannot be undone in status " + command.status());
        }

        if (!command.undo()) {
            Fail fail = asInverseUnavailable(command, "Undo");
            log.warn("Undo of {} failed: {}", command.kind().displayName(), fail.message());
            return fail;
        }

        history.stepBack();
        log.info("Undid {} (cursor: {})", command.kind().displayName(), history.cursor());
        return Ok.message("Undid " + command.kind().displayName());
    }

    @Override
    public synchronized Outcome tryRedo() {
        Optional<Command> next = history.next();
        if (next.isEmpty()) {
            return Fail.historyExhausted("Nothing to redo");
        }

        Command command = next.get();
        if (command.status() != CommandStatus.UNDONE) {
            return Fail.inverseUnavailable(
                command.kind().displayName() + " cannot be redone in status " + command.status());
        }

        Outcome outcome = command.execute();
        if (outcome.isFail()) {
            Fail fail = asInverseUnavailable(command, "Redo");
            log.warn("Redo of {} failed: {}", command.kind().displayName(), fail.message());
            return fail;
        }

        history.stepForward();
        log.info("Redid {} (cursor: {})", command.kind().displayName(), history.cursor());
        return outcome;
    }

    private static Fail asInverseUnavailable(Command command, String action) {
        Optional<Fail> error = command.error();
        if (error.isEmpty()) {
            return Fail.inverseUnavailable(action + " of " + command.kind().displayName() + " failed");
        }
        Fail fail = error.get();
        if (fail.errorCode() == ErrorCode.INVERSE_UNAVAILABLE) {
            return fail;
        }
        return Fail.of(ErrorCode.INVERSE_UNAVAILABLE,
            action + " of " + command.kind().displayName() + " failed: " + fail.message(),
            fail.errorCode().name());
    }

    @Override
    public synchronized boolean canUndo() {
        return history.canUndo();
    }

    @Override
    public synchronized boolean canRedo() {
        return history.canRedo();
    }

    @Override
    public synchronized List<CommandDescription> history() {
        return describe(history.entries());
    }

    @Override
    public synchronized List<CommandDescription> history(int from, int to) {
        return describe(history.entries(from, to));
    }

    private static List<CommandDescription> describe(List<Command> commands) {
        return commands.stream()
            .map(Command::describe)
            .toList();
    }

    @Override
    public synchronized HistoryStatistics statistics() {
        int executed = 0;
        int undone = 0;
        int failed = 0;
        Map<CommandKind, Integer> byKind = new EnumMap<>(CommandKind.class);
        for (Command command : history.entries()) {
            switch (command.status()) {
                case EXECUTED -> executed++;
                case UNDONE -> undone++;
                case FAILED -> failed++;
                default -> {
                    // PENDING은 이력에 들어오지 않음
                }
            }
            byKind.merge(command.kind(), 1, Integer::sum);
        }
        return new HistoryStatistics(history.size(), executed, undone, failed,
            history.cursor(), history.maxSize(), byKind);
    }

    @Override
    public synchronized void clearHistory() {
        int cleared = history.size();
        history.clear();
        log.info("History cleared ({} entries)", cleared);
    }
}
