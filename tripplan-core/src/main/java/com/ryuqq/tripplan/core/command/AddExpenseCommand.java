package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.contract.CommandKind;
import com.ryuqq.tripplan.core.model.Entity;
import com.ryuqq.tripplan.core.model.EntityKind;
import com.ryuqq.tripplan.core.model.Expense;
import com.ryuqq.tripplan.core.model.Payload;
import com.ryuqq.tripplan.core.outcome.Fail;
import com.ryuqq.tripplan.core.outcome.Outcome;
import com.ryuqq.tripplan.core.spi.Receiver;
import com.ryuqq.tripplan.core.statemachine.CommandStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Trip에 지출 기록 추가.
 *
 * <p>금액은 0 이상이어야 하며 통화와 분류는 비어 있을 수 없습니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class AddExpenseCommand implements Command {

    private final String description;
    private final BigDecimal amount;
    private final String currency;
    private final LocalDate date;
    private final String category;
    private final long tripId;
    private final ItemInsertion<Expense> insertion;
    private final CommandLifecycle lifecycle;

    public AddExpenseCommand(Receiver receiver, Clock clock, long tripId, String description,
                             BigDecimal amount, String currency, LocalDate date, String category) {
        this.insertion = new ItemInsertion<>(receiver, EntityKind.EXPENSES, tripId);
        this.tripId = tripId;
        this.description = description;
        this.amount = amount;
        this.currency = currency;
        this.date = date;
        this.category = category;
        Payload payload = Payload.builder()
            .put("tripId", tripId)
            .put("description", description)
            .put("amount", amount)
            .put("currency", currency)
            .put("date", date)
            .put("category", category)
            .build();
        this.lifecycle = new CommandLifecycle(CommandKind.ADD_EXPENSE, payload, clock);
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        Optional<Fail> missing = new RequiredFields("expense")
            .text("description", description)
            .value("amount", amount)
            .text("currency", currency)
            .value("date", date)
            .text("category", category)
            .check();
        if (missing.isPresent()) {
            return lifecycle.failed(missing.get());
        }
        if (amount.signum() < 0) {
            return lifecycle.failed(Fail.validation("Expense amount cannot be negative (current: " + amount + ")"));
        }
        return insertion.insert(lifecycle, Expense.draft(tripId, description, amount, currency, date, category));
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> insertion.remove(lifecycle));
    }

    public Optional<Expense> insertedExpense() {
        return insertion.insertedItem();
    }

    @Override
    public CommandKind kind() {
        return CommandKind.ADD_EXPENSE;
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
