package com.ryuqq.tripplan.application.invoker;

import com.ryuqq.tripplan.core.contract.Command;
import com.ryuqq.tripplan.core.contract.CommandDescription;
import com.ryuqq.tripplan.core.outcome.Outcome;

import java.util.List;

/**
 * Command 실행 및 undo/redo 조정자.
 *
 * <p>Command를 실행하고 성공한 Command만 이력에 기록합니다.
 * 이력은 선형이며, 되돌린 상태에서 새 Command를 실행하면 redo 후보는 모두 버려집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = invoker.execute(factory.updateBudget(tripId, new BigDecimal("1000")));
 *
 * if (outcome.isOk()) {
 *     invoker.undo();   // 예산 복원
 *     invoker.redo();   // 예산 재적용
 * }
 * </pre>
 *
 * <p><strong>동시성:</strong> execute, undo, redo, statistics 등 모든 호출은 Invoker 단위로 상호 배제됩니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public interface CommandInvoker {

    /**
     * Command 실행 및 이력 기록.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>PENDING 상태가 아니면 VALIDATION_FAILURE로 거부</li>
     *   <li>커서 이후 redo 후보 제거</li>
     *   <li>Command 실행</li>
     *   <li>성공 시 이력 끝에 추가, 최대 크기를 넘으면 가장 오래된 항목 제거</li>
     * </ol>
     *
     * @param command 실행할 Command (PENDING 상태)
     * @return 실행 결과 (실패한 Command는 이력에 남지 않음)
     * @throws IllegalArgumentException command가 null인 경우
     */
    Outcome execute(Command command);

    /**
     * 커서 위치 Command를 되돌림.
     *
     * @return 성공 여부
     */
    boolean undo();

    /**
     * 커서 다음 Command를 다시 적용.
     *
     * @return 성공 여부
     */
    boolean redo();

    /**
     * undo와 같지만 실패 사유를 반환.
     *
     * @return Ok, 또는 HISTORY_EXHAUSTED / INVERSE_UNAVAILABLE Fail
     */
    Outcome tryUndo();

    /**
     * redo와 같지만 실패 사유를 반환.
     *
     * @return 재적용된 엔티티를 담은 Ok, 또는 HISTORY_EXHAUSTED / INVERSE_UNAVAILABLE Fail
     */
    Outcome tryRedo();

    boolean canUndo();

    boolean canRedo();

    /**
     * 전체 이력 조회 (오래된 순).
     *
     * @return Command 설명 목록
     */
    List<CommandDescription> history();

    /**
     * 이력 구간 조회 ({@code [from, to)}, 범위 밖 인덱스는 보정).
     *
     * @param from 시작 인덱스 (포함)
     * @param to 끝 인덱스 (제외)
     * @return Command 설명 목록
     */
    List<CommandDescription> history(int from, int to);

    /**
     * 이력 통계 (호출 시점에 계산).
     *
     * @return 통계
     */
    HistoryStatistics statistics();

    /**
     * 이력 전체 삭제. 저장소 상태는 변경하지 않습니다.
     */
    void clearHistory();
}
