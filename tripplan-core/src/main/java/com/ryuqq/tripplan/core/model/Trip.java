package com.ryuqq.tripplan.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 여행 (Trip).
 *
 * <p>소유자(ownerId)와 공동 작업자(collaborators) 목록, 예산, 공유 코드를 가집니다.
 * 공유 코드는 Receiver 내에서 고유해야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변경은 withXxx 메서드로 새 인스턴스를 생성합니다.</p>
 *
 * @param id Trip ID (초안이면 0)
 * @param ownerId 소유자 사용자 ID
 * @param destination 목적지
 * @param name 여행 이름
 * @param startDate 시작일
 * @param endDate 종료일
 * @param budget 예산 (null이면 0)
 * @param shareCode 공유 코드
 * @param collaborators 공동 작업자 사용자 ID 목록 (null이면 빈 목록)
 * @param suggestion 추천 여행 여부
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record Trip(
    long id,
    long ownerId,
    String destination,
    String name,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal budget,
    String shareCode,
    List<Long> collaborators,
    boolean suggestion
) implements Entity<Trip> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Trip {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate cannot be null");
        }
        if (shareCode == null || shareCode.isBlank()) {
            throw new IllegalArgumentException("shareCode cannot be null or blank");
        }
        budget = budget == null ? BigDecimal.ZERO : budget;
        collaborators = collaborators == null ? List.of() : List.copyOf(collaborators);
    }

    /**
     * 예산 0, 공동 작업자 없는 새 여행 초안 생성.
     *
     * @param ownerId 소유자 사용자 ID
     * @param destination 목적지
     * @param name 여행 이름
     * @param startDate 시작일
     * @param endDate 종료일
     * @param shareCode 공유 코드
     * @return ID가 할당되지 않은 Trip
     */
    public static Trip draft(long ownerId, String destination, String name,
                             LocalDate startDate, LocalDate endDate, String shareCode) {
        return new Trip(UNASSIGNED_ID, ownerId, destination, name, startDate, endDate,
            BigDecimal.ZERO, shareCode, List.of(), false);
    }

    @Override
    public Trip withId(long id) {
        return new Trip(id, ownerId, destination, name, startDate, endDate, budget, shareCode, collaborators, suggestion);
    }

    public Trip withBudget(BigDecimal budget) {
        return new Trip(id, ownerId, destination, name, startDate, endDate, budget, shareCode, collaborators, suggestion);
    }

    /**
     * 공동 작업자를 추가한 새 인스턴스 생성.
     *
     * <p>이미 공동 작업자이거나 소유자인 경우 자기 자신을 반환합니다.</p>
     *
     * @param userId 사용자 ID
     * @return 새 Trip 또는 this
     */
    public Trip withCollaborator(long userId) {
        if (isOwner(userId) || hasCollaborator(userId)) {
            return this;
        }
        List<Long> updated = new ArrayList<>(collaborators);
        updated.add(userId);
        return new Trip(id, ownerId, destination, name, startDate, endDate, budget, shareCode, updated, suggestion);
    }

    /**
     * 공동 작업자를 제거한 새 인스턴스 생성.
     *
     * @param userId 사용자 ID
     * @return 새 Trip, 공동 작업자가 아니면 this
     */
    public Trip withoutCollaborator(long userId) {
        if (!hasCollaborator(userId)) {
            return this;
        }
        List<Long> updated = new ArrayList<>(collaborators);
        updated.remove(Long.valueOf(userId));
        return new Trip(id, ownerId, destination, name, startDate, endDate, budget, shareCode, updated, suggestion);
    }

    public boolean isOwner(long userId) {
        return ownerId == userId;
    }

    public boolean hasCollaborator(long userId) {
        return collaborators.contains(userId);
    }
}
