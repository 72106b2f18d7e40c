package com.ryuqq.tripplan.application.invoker;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.history.HistoryConfig;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.ErrorCode;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Ok;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * HistoryCommandInvoker 유닛 테스트 (Command Mock 사용).
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
class HistoryCommandInvokerTest {

    private HistoryCommandInvoker invoker;

    @BeforeEach
    void setUp() {
        invoker = new HistoryCommandInvoker(new HistoryConfig(3));
    }

    private static Command command(CommandKind kind, CommandStatus first, CommandStatus... rest) {
        Command command = mock(Command.class);
        when(command.kind()).thenReturn(kind);
        when(command.payload()).thenReturn(Payload.empty());
        when(command.status()).thenReturn(first, rest);
        when(command.error()).thenReturn(Optional.empty());
        return command;
    }

    // ========== execute ==========

    @Test
    void execute_성공하면_이력에_추가() {
        // given
        Command command = command(CommandKind.UPDATE_BUDGET, CommandStatus.PENDING, CommandStatus.EXECUTED);
        when(command.execute()).thenReturn(Ok.message("done"));

        // when
        Outcome outcome = invoker.execute(command);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(invoker.canUndo()).isTrue();
        assertThat(invoker.statistics().total()).isEqualTo(1);
        assertThat(invoker.statistics().cursor()).isZero();
    }

    @Test
    void execute_PENDING이_아니면_실행하지_않고_거부() {
        // given
        Command command = command(CommandKind.UPDATE_BUDGET, CommandStatus.EXECUTED);

        // when
        Fail fail = (Fail) invoker.execute(command);

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILURE);
        verify(command, never()).execute();
        assertThat(invoker.statistics().total()).isZero();
    }

    @Test
    void execute_실패하면_이력에_추가하지_않음() {
        // given
        Command command = command(CommandKind.ADD_FLIGHT, CommandStatus.PENDING, CommandStatus.FAILED);
        Fail notFound = Fail.notFound("Trip 7 not found");
        when(command.execute()).thenReturn(notFound);

        // when
        Outcome outcome = invoker.execute(command);

        // then
        assertThat(outcome).isSameAs(notFound);
        assertThat(invoker.canUndo()).isFalse();
        assertThat(invoker.statistics().total()).isZero();
    }

    @Test
    void execute_null이면_예외() {
        assertThatThrownBy(() -> invoker.execute(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("command cannot be null");
    }

    @Test
    void execute_최대_크기_초과시_가장_오래된_항목_제거() {
        // given
        Command first = command(CommandKind.CREATE_TRIP, CommandStatus.PENDING, CommandStatus.EXECUTED);
        when(first.execute()).thenReturn(Ok.message("first"));
        invoker.execute(first);
        for (int i = 0; i < 3; i++) {
            Command next = command(CommandKind.ADD_ACTIVITY, CommandStatus.PENDING, CommandStatus.EXECUTED);
            when(next.execute()).thenReturn(Ok.message("next"));
            invoker.execute(next);
        }

        // when
        HistoryStatistics statistics = invoker.statistics();

        // then
        assertThat(statistics.total()).isEqualTo(3);
        assertThat(statistics.cursor()).isEqualTo(2);
        assertThat(statistics.countOf(CommandKind.CREATE_TRIP)).isZero();
        assertThat(statistics.countOf(CommandKind.ADD_ACTIVITY)).isEqualTo(3);
    }

    // ========== undo ==========

    @Test
    void tryUndo_이력이_비어있으면_HISTORY_EXHAUSTED() {
        // when
        Fail fail = (Fail) invoker.tryUndo();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.HISTORY_EXHAUSTED);
        assertThat(invoker.undo()).isFalse();
    }

    @Test
    void tryUndo_성공하면_커서_이동() {
        // given
        Command command = command(CommandKind.UPDATE_BUDGET,
            CommandStatus.PENDING, CommandStatus.EXECUTED, CommandStatus.UNDONE);
        when(command.execute()).thenReturn(Ok.message("done"));
        when(command.undo()).thenReturn(true);
        invoker.execute(command);

        // when
        Outcome outcome = invoker.tryUndo();

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(((Ok) outcome).message()).isEqualTo("Undid UpdateBudget");
        assertThat(invoker.statistics().cursor()).isEqualTo(-1);
        assertThat(invoker.canRedo()).isTrue();
    }

    @Test
    void tryUndo_Receiver_오류는_INVERSE_UNAVAILABLE로_감싸고_원래_코드를_cause에_보존() {
        // given
        Command command = command(CommandKind.UPDATE_BUDGET, CommandStatus.PENDING, CommandStatus.EXECUTED);
        when(command.execute()).thenReturn(Ok.message("done"));
        when(command.undo()).thenReturn(false);
        when(command.error()).thenReturn(Optional.of(
            Fail.of(ErrorCode.RECEIVER_FAILURE, "UpdateBudget undo failed in receiver", "java.lang.IllegalStateException")));
        invoker.execute(command);

        // when
        Fail fail = (Fail) invoker.tryUndo();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.INVERSE_UNAVAILABLE);
        assertThat(fail.message()).isEqualTo("Undo of UpdateBudget failed: UpdateBudget undo failed in receiver");
        assertThat(fail.cause()).isEqualTo("RECEIVER_FAILURE");
        assertThat(invoker.statistics().cursor()).isZero();
    }

    @Test
    void tryUndo_이미_INVERSE_UNAVAILABLE이면_그대로_반환() {
        // given
        Command command = command(CommandKind.ADD_HOTEL, CommandStatus.PENDING, CommandStatus.EXECUTED);
        Fail gone = Fail.inverseUnavailable("hotel 4 no longer exists");
        when(command.execute()).thenReturn(Ok.message("done"));
        when(command.undo()).thenReturn(false);
        when(command.error()).thenReturn(Optional.of(gone));
        invoker.execute(command);

        // when
        Outcome outcome = invoker.tryUndo();

        // then
        assertThat(outcome).isSameAs(gone);
    }

    // ========== redo ==========

    @Test
    void tryRedo_redo_대상이_없으면_HISTORY_EXHAUSTED() {
        // given
        Command command = command(CommandKind.UPDATE_BUDGET, CommandStatus.PENDING, CommandStatus.EXECUTED);
        when(command.execute()).thenReturn(Ok.message("done"));
        invoker.execute(command);

        // when
        Fail fail = (Fail) invoker.tryRedo();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.HISTORY_EXHAUSTED);
        assertThat(invoker.redo()).isFalse();
    }

    @Test
    void tryRedo_실패하면_커서_유지하고_이후_redo_차단() {
        // given
        Command command = command(CommandKind.ADD_ACTIVITY,
            CommandStatus.PENDING, CommandStatus.EXECUTED, CommandStatus.UNDONE, CommandStatus.FAILED);
        when(command.execute()).thenReturn(Ok.message("done"), Fail.notFound("Trip 1 not found"));
        when(command.undo()).thenReturn(true);
        invoker.execute(command);
        invoker.tryUndo();
        when(command.error()).thenReturn(Optional.of(Fail.notFound("Trip 1 not found")));

        // when
        Fail fail = (Fail) invoker.tryRedo();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.INVERSE_UNAVAILABLE);
        assertThat(fail.cause()).isEqualTo("NOT_FOUND");
        assertThat(invoker.statistics().cursor()).isEqualTo(-1);
        assertThat(invoker.canRedo()).isFalse();
        assertThat(invoker.statistics().failed()).isEqualTo(1);
    }

    // ========== history ==========

    @Test
    void clearHistory_이력과_커서_초기화() {
        // given
        Command command = command(CommandKind.UPDATE_BUDGET, CommandStatus.PENDING, CommandStatus.EXECUTED);
        when(command.execute()).thenReturn(Ok.message("done"));
        invoker.execute(command);

        // when
        invoker.clearHistory();

        // then
        assertThat(invoker.history()).isEmpty();
        assertThat(invoker.statistics().cursor()).isEqualTo(-1);
        assertThat(invoker.canUndo()).isFalse();
        verify(command, never()).undo();
    }

    @Test
    void constructor_null_설정이면_예외() {
        assertThatThrownBy(() -> new HistoryCommandInvoker(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_매우_큰_maxSize로도_생성_및_실행_가능() {
        // given
        HistoryCommandInvoker large = new HistoryCommandInvoker(new HistoryConfig(Integer.MAX_VALUE));
        Command command = command(CommandKind.UPDATE_BUDGET, CommandStatus.PENDING, CommandStatus.EXECUTED);
        when(command.execute()).thenReturn(Ok.message("done"));

        // when
        Outcome outcome = large.execute(command);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(large.statistics().maxSize()).isEqualTo(Integer.MAX_VALUE);
        assertThat(large.statistics().total()).isEqualTo(1);
    }
}
