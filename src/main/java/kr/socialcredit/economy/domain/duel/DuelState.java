package kr.socialcredit.economy.domain.duel;

/**
 * 결투 세션 상태
 */
public enum DuelState {

    OPEN("모집중"),
    ACCEPTED("수락됨"),
    RESOLVED("종료"),
    EXPIRED("만료"),
    CANCELLED("취소");

    private final String displayName;

    DuelState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(DuelState target) {
        return switch (this) {
            case OPEN -> target == ACCEPTED || target == EXPIRED || target == CANCELLED;
            case ACCEPTED -> target == RESOLVED || target == CANCELLED;
            case RESOLVED, EXPIRED, CANCELLED -> false; // 최종 상태
        };
    }

    public boolean isFinal() {
        return this == RESOLVED || this == EXPIRED || this == CANCELLED;
    }
}
