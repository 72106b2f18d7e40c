package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Trip;
import com.ryuqq.tripplan.core.outcome.ErrorCode;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Ok;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * CreateTripCommand 유닛 테스트.
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CreateTripCommandTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate START = LocalDate.of(2025, 4, 1);
    private static final LocalDate END = LocalDate.of(2025, 4, 7);
    private static final Trip OTHER_TRIP = Trip.draft(2L, "Porto", "Weekend", START, END, "OTHER1").withId(1L);

    @Mock
    private Receiver receiver;

    @Mock
    private ShareCodeGenerator generator;

    private CreateTripCommand command(String shareCode) {
        return new CreateTripCommand(receiver, CLOCK, generator, 1L, "Lisbon", "Spring break", START, END, shareCode);
    }

    private void storesWhateverIsInserted() {
        when(receiver.insertWithId(eq(EntityKind.TRIPS), any(Trip.class)))
            .thenAnswer(invocation -> Optional.of(invocation.getArgument(1)));
    }

    @Test
    void execute_공유코드가_없으면_미사용_코드를_생성() {
        // given
        when(generator.next()).thenReturn("TAKEN1", "FREE22");
        when(receiver.findTripByShareCode("TAKEN1")).thenReturn(Optional.of(OTHER_TRIP));
        when(receiver.findTripByShareCode("FREE22")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        CreateTripCommand command = command(null);

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(command.status()).isEqualTo(CommandStatus.EXECUTED);
        Trip created = command.createdTrip().orElseThrow();
        assertThat(created.id()).isEqualTo(4L);
        assertThat(created.shareCode()).isEqualTo("FREE22");
        assertThat(command.result()).contains(created);
    }

    @Test
    void describe_생성된_공유코드를_입력값에_반영() {
        // given
        when(generator.next()).thenReturn("FREE22");
        when(receiver.findTripByShareCode("FREE22")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        CreateTripCommand command = command(null);
        boolean codeBeforeExecute = command.describe().payload().get("shareCode").isPresent();

        // when
        command.execute();

        // then
        assertThat(codeBeforeExecute).isFalse();
        assertThat(command.describe().payload().get("shareCode")).contains("FREE22");
        assertThat(command.payload().get("ownerId")).contains(1L);
    }

    @Test
    void execute_코드_생성이_계속_충돌하면_VALIDATION_FAILURE() {
        // given
        when(generator.next()).thenReturn("TAKEN1");
        when(receiver.findTripByShareCode("TAKEN1")).thenReturn(Optional.of(OTHER_TRIP));
        CreateTripCommand command = command("");

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail) outcome).errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILURE);
        verify(generator, times(CreateTripCommand.MAX_SHARE_CODE_ATTEMPTS)).next();
        verify(receiver, never()).nextId(any());
    }

    @Test
    void execute_지정한_공유코드가_사용중이면_VALIDATION_FAILURE() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.of(OTHER_TRIP));
        CreateTripCommand command = command("ABC123");

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(((Fail) outcome).message()).contains("Share code already in use");
        assertThat(command.status()).isEqualTo(CommandStatus.FAILED);
        assertThat(command.error()).contains((Fail) outcome);
        verifyNoInteractions(generator);
    }

    @Test
    void execute_종료일이_시작일보다_앞서면_저장소를_건드리지_않음() {
        // given
        CreateTripCommand command = new CreateTripCommand(receiver, CLOCK, generator,
            1L, "Lisbon", "Spring break", END, START, "ABC123");

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(((Fail) outcome).errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILURE);
        verifyNoInteractions(receiver);
    }

    @Test
    void execute_필수값이_없으면_누락_필드를_모두_보고() {
        // given
        CreateTripCommand command = new CreateTripCommand(receiver, CLOCK, generator,
            1L, " ", null, START, null, null);

        // when
        Fail fail = (Fail) command.execute();

        // then
        assertThat(fail.message()).isEqualTo("Missing required trip fields: destination, name, endDate");
    }

    @Test
    void execute_소유자_ID가_양수가_아니면_실패() {
        // given
        CreateTripCommand command = new CreateTripCommand(receiver, CLOCK, generator,
            0L, "Lisbon", "Spring break", START, END, null);

        // when & then
        assertThat(command.execute().isFail()).isTrue();
        verifyNoInteractions(receiver, generator);
    }

    @Test
    void undo_생성한_Trip을_삭제() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        when(receiver.delete(EntityKind.TRIPS, 4L)).thenReturn(true);
        CreateTripCommand command = command("ABC123");
        command.execute();

        // when
        boolean undone = command.undo();

        // then
        assertThat(undone).isTrue();
        assertThat(command.status()).isEqualTo(CommandStatus.UNDONE);
        assertThat(command.describe().undoneAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void undo_이미_삭제되었으면_INVERSE_UNAVAILABLE_상태_유지() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        when(receiver.delete(EntityKind.TRIPS, 4L)).thenReturn(false);
        CreateTripCommand command = command("ABC123");
        command.execute();

        // when
        boolean undone = command.undo();

        // then
        assertThat(undone).isFalse();
        assertThat(command.status()).isEqualTo(CommandStatus.EXECUTED);
        assertThat(command.error()).map(Fail::errorCode).contains(ErrorCode.INVERSE_UNAVAILABLE);
    }

    @Test
    void redo_같은_Trip을_같은_ID로_재삽입() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        when(receiver.delete(EntityKind.TRIPS, 4L)).thenReturn(true);
        CreateTripCommand command = command("ABC123");
        command.execute();
        Trip created = command.createdTrip().orElseThrow();
        command.undo();

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(outcome).isEqualTo(Ok.of(created));
        assertThat(command.status()).isEqualTo(CommandStatus.EXECUTED);
        verify(receiver, times(1)).nextId(EntityKind.TRIPS);
        verify(receiver, times(2)).insertWithId(EntityKind.TRIPS, created);
    }

    @Test
    void redo_공유코드를_다른_Trip이_차지하면_FAILED() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.empty(), Optional.of(OTHER_TRIP));
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        when(receiver.delete(EntityKind.TRIPS, 4L)).thenReturn(true);
        CreateTripCommand command = command("ABC123");
        command.execute();
        command.undo();

        // when
        Outcome outcome = command.execute();

        // then
        assertThat(outcome.isFail()).isTrue();
        assertThat(command.status()).isEqualTo(CommandStatus.FAILED);
        assertThat(command.canRedo()).isFalse();
    }

    @Test
    void execute_실행된_Command를_다시_실행하면_상태_변경_없이_거부() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        CreateTripCommand command = command("ABC123");
        command.execute();

        // when
        Outcome second = command.execute();

        // then
        assertThat(((Fail) second).message()).contains("cannot be executed in status EXECUTED");
        assertThat(command.status()).isEqualTo(CommandStatus.EXECUTED);
        assertThat(command.error()).isEmpty();
    }

    @Test
    void execute_Receiver_예외는_RECEIVER_FAILURE로_변환() {
        // given
        when(receiver.findTripByShareCode(anyString())).thenThrow(new IllegalStateException("disk full"));
        CreateTripCommand command = command("ABC123");

        // when
        Fail fail = (Fail) command.execute();

        // then
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.RECEIVER_FAILURE);
        assertThat(fail.cause()).contains("disk full");
        assertThat(command.status()).isEqualTo(CommandStatus.FAILED);
    }

    @Test
    void undo_실행_전에는_false() {
        // when & then
        assertThat(command("ABC123").undo()).isFalse();
        verifyNoInteractions(receiver);
    }

    @Test
    void describe_입력값과_실행_시각을_노출() {
        // given
        when(receiver.findTripByShareCode("ABC123")).thenReturn(Optional.empty());
        when(receiver.nextId(EntityKind.TRIPS)).thenReturn(4L);
        storesWhateverIsInserted();
        CreateTripCommand command = command("ABC123");
        command.execute();

        // when
        CommandDescription description = command.describe();

        // then
        assertThat(description.kind()).isEqualTo(CommandKind.CREATE_TRIP);
        assertThat(description.executedAt()).isEqualTo(CLOCK.instant());
        assertThat(description.payload().get("destination")).contains("Lisbon");
        assertThat(description.summary()).startsWith("CreateTrip[EXECUTED] {ownerId=1, destination=Lisbon");
    }
}
