package com.ryuqq.tripplan.core.contract;

/**
 * Command 종류 (변경 유형 태그).
 *
 * <p>통계와 describe() 결과에서 Command를 분류하는 데 사용됩니다.
 * 새로운 변경 유형을 추가할 때는 상수와 Command 구현을 함께 추가합니다.</p>
 *
 * @author Trip Planner Team
 * @since 1.0.0
 */
public enum CommandKind {

    CREATE_TRIP("CreateTrip"),
    UPDATE_BUDGET("UpdateBudget"),
    ADD_COLLABORATOR("AddCollaborator"),
    ADD_FLIGHT("AddFlight"),
    ADD_HOTEL("AddHotel"),
    ADD_ACTIVITY("AddActivity"),
    ADD_EXPENSE("AddExpense"),
    UPDATE_ITEM_STATUS("UpdateItemStatus");

    private final String displayName;

    CommandKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 표시용 이름 (예: "CreateTrip").
     *
     * @return 표시용 이름
     */
    public String displayName() {
        return displayName;
    }
}
