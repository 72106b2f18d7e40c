package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Trip;
import com.ryuqq.tripplan.core.outcome.ErrorCode;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * AddCollaboratorCommand 유닛 테스트.
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AddCollaboratorCommandTest {

    private static final Trip TRIP = Trip.draft(1L, "Lisbon", "Spring break",
        LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 7), "ABC123").withId(3L);

    @Mock
    private Receiver receiver;

    private AddCollaboratorCommand command(long userId) {
        return new AddCollaboratorCommand(receiver, Clock.systemUTC(), 3L, userId);
    }

    @Test
    void execute_협업자_추가() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L))
            .thenReturn(Optional.of(TRIP), Optional.of(TRIP.withCollaborator(9L)));
        when(receiver.addCollaborator(3L, 9L)).thenReturn(true);
        AddCollaboratorCommand command = command(9L);

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(command.result()).contains(TRIP.withCollaborator(9L));
    }

    @Test
    void execute_이미_협업자면_VALIDATION_FAILURE() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.of(TRIP.withCollaborator(9L)));
        AddCollaboratorCommand command = command(9L);

        // when
        Fail fail = (Fail) command.execute();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILURE);
        assertThat(fail.message()).contains("already a collaborator");
        verify(receiver, never()).addCollaborator(anyLong(), anyLong());
    }

    @Test
    void execute_소유자면_VALIDATION_FAILURE() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.of(TRIP));

        // when
        Fail fail = (Fail) command(1L).execute();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILURE);
        assertThat(fail.message()).contains("owns trip");
    }

    @Test
    void execute_Trip이_없으면_NOT_FOUND() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.empty());

        // when
        Fail fail = (Fail) command(9L).execute();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void execute_조회와_추가_사이에_다른_요청이_추가하면_실패() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.of(TRIP));
        when(receiver.addCollaborator(3L, 9L)).thenReturn(false);
        AddCollaboratorCommand command = command(9L);

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(outcome.isFail()).isTrue();
        assertThat(command.status()).isEqualTo(CommandStatus.FAILED);
    }

    @Test
    void execute_사용자_ID가_양수가_아니면_실패() {
        // when
        Fail fail = (Fail) command(0L).execute();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILURE);
        verifyNoInteractions(receiver);
    }

    @Test
    void undo_추가한_사용자_제거() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.of(TRIP));
        when(receiver.addCollaborator(3L, 9L)).thenReturn(true);
        when(receiver.removeCollaborator(3L, 9L)).thenReturn(true);
        AddCollaboratorCommand command = command(9L);
        command.execute();

        // when
        boolean undone = command.undo();

        // then
        assertThat(undone).isTrue();
        assertThat(command.status()).isEqualTo(CommandStatus.UNDONE);
    }

    @Test
    void undo_이미_제거되었으면_INVERSE_UNAVAILABLE() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.of(TRIP));
        when(receiver.addCollaborator(3L, 9L)).thenReturn(true);
        when(receiver.removeCollaborator(3L, 9L)).thenReturn(false);
        AddCollaboratorCommand command = command(9L);
        command.execute();

        // when
        boolean undone = command.undo();

        // then
        assertThat(undone).isFalse();
        assertThat(command.status()).isEqualTo(CommandStatus.EXECUTED);
        assertThat(command.error()).map(Fail::errorCode).contains(ErrorCode.INVERSE_UNAVAILABLE);
    }

    @Test
    void undo_Receiver_예외는_RECEIVER_FAILURE로_기록하고_상태_유지() {
        // given
        when(receiver.findById(EntityKind.TRIPS, 3L)).thenReturn(Optional.of(TRIP));
        when(receiver.addCollaborator(3L, 9L)).thenReturn(true);
        when(receiver.removeCollaborator(3L, 9L)).thenThrow(new IllegalStateException("locked"));
        AddCollaboratorCommand command = command(9L);
        command.execute();

        // when
        boolean undone = command.undo();

        // then
        assertThat(undone).isFalse();
        assertThat(command.status()).isEqualTo(CommandStatus.EXECUTED);
        assertThat(command.error()).map(Fail::errorCode).contains(ErrorCode.RECEIVER_FAILURE);
    }
}
