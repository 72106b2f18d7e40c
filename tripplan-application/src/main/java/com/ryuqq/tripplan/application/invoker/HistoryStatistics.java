package com.ryuqq.tripplan.application.invoker;

import com.ryuqq.tripplan.core.contract.CommandKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 이력 통계 스냅샷.
 *
 * <p>누적 카운터 없이 호출 시점의 이력 항목에서 매번 계산됩니다.</p>
 *
 * @param total 이력 항목 수
 * @param executed EXECUTED 상태 항목 수
 * @param undone UNDONE 상태 항목 수
 * @param failed FAILED 상태 항목 수 (redo 실패로 남은 항목)
 * @param cursor 현재 커서 (-1이면 적용된 항목 없음)
 * @param maxSize 최대 이력 크기
 * @param byKind 종류별 항목 수
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public record HistoryStatistics(
    int total,
    int executed,
    int undone,
    int failed,
    int cursor,
    int maxSize,
    Map<CommandKind, Integer> byKind
) {

    public HistoryStatistics {
        if (byKind == null) {
            throw new IllegalArgumentException("byKind cannot be null");
        }
        byKind = byKind.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(byKind));
    }

    /**
     * 특정 종류의 항목 수.
     *
     * @param kind Command 종류
     * @return 항목 수 (없으면 0)
     */
    public int countOf(CommandKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
