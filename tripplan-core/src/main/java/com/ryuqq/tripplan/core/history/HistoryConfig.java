package com.ryuqq.tripplan.core.history;

/**
 * Command 이력 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxSize: 보관할 최대 Command 수 (기본 100). 초과 시 가장 오래된 항목부터 제거</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong> 값이 클수록 더 오래 되돌릴 수 있지만
 * 각 항목이 역연산 상태(생성된 엔티티 등)를 보관하므로 메모리 사용량이 늘어납니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 * @param maxSize 최대 이력 크기 (1 이상이어야 함)
 */
public record HistoryConfig(int maxSize) {

    public static final int DEFAULT_MAX_SIZE = 100;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxSize=100</p>
     */
    public HistoryConfig() {
        this(DEFAULT_MAX_SIZE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException maxSize가 1 미만인 경우
     */
    public HistoryConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException(
                "maxSize must be positive (current: " + maxSize + ")"
            );
        }
    }

    /**
     * maxSize만 변경한 새 인스턴스 생성.
     *
     * @param maxSize 새로운 최대 이력 크기
     * @return 새 HistoryConfig 인스턴스
     */
    public HistoryConfig withMaxSize(int maxSize) {
        return new HistoryConfig(maxSize);
    }
}
