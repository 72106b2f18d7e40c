package com.ryuqq.tripplan.core.contract;

import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandDescription 테스트.
 */
class CommandDescriptionTest {

    @Test
    void summary_종류_상태_입력값_포함() {
        Payload payload = Payload.builder().put("tripId", 3L).put("newBudget", "1000").build();
        CommandDescription description = new CommandDescription(
            CommandKind.UPDATE_BUDGET, CommandStatus.EXECUTED, null, null, payload, null);

        String summary = description.summary();

        assertTrue(summary.startsWith("UpdateBudget[EXECUTED] {"));
        assertTrue(summary.contains("tripId=3"));
    }

    @Test
    void summary_오류가_있으면_메시지_포함() {
        CommandDescription description = new CommandDescription(
            CommandKind.ADD_FLIGHT, CommandStatus.FAILED, null, null, Payload.empty(),
            Fail.notFound("Trip 7 not found"));

        assertTrue(description.summary().contains("Trip 7 not found"));
    }

    @Test
    void 필수값이_null이면_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> new CommandDescription(null, CommandStatus.PENDING, null, null, Payload.empty(), null));
        assertThrows(IllegalArgumentException.class,
            () -> new CommandDescription(CommandKind.CREATE_TRIP, null, null, null, Payload.empty(), null));
        assertThrows(IllegalArgumentException.class,
            () -> new CommandDescription(CommandKind.CREATE_TRIP, CommandStatus.PENDING, null, null, null, null));
    }
}
