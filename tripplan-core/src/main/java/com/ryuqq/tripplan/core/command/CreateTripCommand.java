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

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * 새 여행 생성.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 검증 (소유자, 목적지, 이름, 날짜 순서)</li>
 *   <li>공유 코드 결정: 지정된 코드가 사용 중이면 실패, 없으면 사용되지 않은 코드 생성</li>
 *   <li>{@link Receiver#nextId(EntityKind)}로 Trip ID를 할당받아 삽입</li>
 * </ol>
 *
 * <p>공유 코드를 생성한 경우 실행 성공 후 {@link #payload()}와 {@link #describe()}의 shareCode가
 * 생성된 코드로 채워집니다.</p>
 *
 * <p><strong>역연산 상태:</strong> 생성된 Trip 전체 (ID 포함)</p>
 * <p><strong>undo:</strong> 캡처한 ID의 Trip 삭제</p>
 * <p><strong>redo:</strong> 같은 Trip을 같은 ID로 다시 삽입 (공유 코드가 다른 Trip에 사용 중이면 실패)</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public final class CreateTripCommand implements Command {

    static final int MAX_SHARE_CODE_ATTEMPTS = 20;

    private final Receiver receiver;
    private final ShareCodeGenerator shareCodeGenerator;
    private final long ownerId;
    private final String destination;
    private final String name;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final String shareCode;
    private final CommandLifecycle lifecycle;

    private Trip createdTrip;

    /**
     * 생성자.
     *
     * @param receiver 대상 저장소
     * @param clock 타임스탬프용 시계
     * @param shareCodeGenerator 공유 코드 생성기
     * @param ownerId 소유자 사용자 ID
     * @param destination 목적지
     * @param name 여행 이름
     * @param startDate 시작일
     * @param endDate 종료일
     * @param shareCode 공유 코드 (null 또는 빈 문자열이면 자동 생성)
     * @throws IllegalArgumentException receiver, clock, shareCodeGenerator 중 하나가 null인 경우
     */
    public CreateTripCommand(Receiver receiver, Clock clock, ShareCodeGenerator shareCodeGenerator,
                             long ownerId, String destination, String name,
                             LocalDate startDate, LocalDate endDate, String shareCode) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (shareCodeGenerator == null) {
            throw new IllegalArgumentException("shareCodeGenerator cannot be null");
        }
        this.receiver = receiver;
        this.shareCodeGenerator = shareCodeGenerator;
        this.ownerId = ownerId;
        this.destination = destination;
        this.name = name;
        this.startDate = startDate;
        this.endDate = endDate;
        this.shareCode = shareCode;
        this.lifecycle = new CommandLifecycle(CommandKind.CREATE_TRIP, payload(shareCode), clock);
    }

    private Payload payload(String code) {
        return Payload.builder()
            .put("ownerId", ownerId)
            .put("destination", destination)
            .put("name", name)
            .put("startDate", startDate)
            .put("endDate", endDate)
            .put("shareCode", code)
            .build();
    }

    @Override
    public Outcome execute() {
        return lifecycle.execute(this::apply);
    }

    private Outcome apply() {
        Optional<Fail> invalid = validate();
        if (invalid.isPresent()) {
            return lifecycle.failed(invalid.get());
        }
        return lifecycle.isRedo() ? reinsert() : create();
    }

    private Optional<Fail> validate() {
        if (ownerId <= 0) {
            return Optional.of(Fail.validation("ownerId must be positive (current: " + ownerId + ")"));
        }
        Optional<Fail> missing = new RequiredFields("trip")
            .text("destination", destination)
            .text("name", name)
            .value("startDate", startDate)
            .value("endDate", endDate)
            .check();
        if (missing.isPresent()) {
            return missing;
        }
        if (startDate.isAfter(endDate)) {
            return Optional.of(Fail.validation(
                "startDate " + startDate + " cannot be after endDate " + endDate));
        }
        return Optional.empty();
    }

    private Outcome create() {
        String code;
        if (shareCode == null || shareCode.isBlank()) {
            Optional<String> generated = generateUnusedShareCode();
            if (generated.isEmpty()) {
                return lifecycle.failed(Fail.validation(
                    "Could not generate an unused share code after " + MAX_SHARE_CODE_ATTEMPTS + " attempts"));
            }
            code = generated.get();
        } else {
            if (receiver.findTripByShareCode(shareCode).isPresent()) {
                return lifecycle.failed(Fail.validation("Share code already in use: " + shareCode));
            }
            code = shareCode;
        }

        Trip trip = Trip.draft(ownerId, destination, name, startDate, endDate, code)
            .withId(receiver.nextId(EntityKind.TRIPS));
        Optional<Trip> stored = receiver.insertWithId(EntityKind.TRIPS, trip);
        if (stored.isEmpty()) {
            return lifecycle.failed(Fail.validation("Share code already in use: " + code));
        }

        createdTrip = stored.get();
        lifecycle.resolvePayload(payload(createdTrip.shareCode()));
        return lifecycle.succeeded(createdTrip);
    }

    private Outcome reinsert() {
        if (receiver.findTripByShareCode(createdTrip.shareCode()).isPresent()) {
            return lifecycle.failed(Fail.validation(
                "Share code already in use: " + createdTrip.shareCode()));
        }
        Optional<Trip> stored = receiver.insertWithId(EntityKind.TRIPS, createdTrip);
        if (stored.isEmpty()) {
            return lifecycle.failed(Fail.validation(
                "Trip id " + createdTrip.id() + " or share code " + createdTrip.shareCode() + " is already in use"));
        }
        return lifecycle.succeeded(stored.get());
    }

    private Optional<String> generateUnusedShareCode() {
        for (int attempt = 0; attempt < MAX_SHARE_CODE_ATTEMPTS; attempt++) {
            String candidate = shareCodeGenerator.next();
            if (candidate != null && !candidate.isBlank()
                && receiver.findTripByShareCode(candidate).isEmpty()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean undo() {
        return lifecycle.undo(() -> {
            if (receiver.delete(EntityKind.TRIPS, createdTrip.id())) {
                return lifecycle.undone();
            }
            return lifecycle.undoFailed(Fail.inverseUnavailable(
                "Trip " + createdTrip.id() + " no longer exists"));
        });
    }

    /**
     * 생성된 Trip 조회 (역연산 상태).
     *
     * @return 생성된 Trip, 실행된 적 없으면 empty
     */
    public Optional<Trip> createdTrip() {
        return Optional.ofNullable(createdTrip);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.CREATE_TRIP;
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
