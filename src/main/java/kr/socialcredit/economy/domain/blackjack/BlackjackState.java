package kr.socialcredit.economy.domain.blackjack;

/**
 * 블랙잭 세션 상태
 */
public enum BlackjackState {

    AWAITING_BET("베팅 대기"),
    PLAYER_TURN("플레이어 차례"),
    RESOLVED("종료"),
    EXPIRED("만료"),
    CANCELLED("강제 종료");

    private final String displayName;

    BlackjackState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(BlackjackState target) {
        return switch (this) {
            case AWAITING_BET -> target == PLAYER_TURN || target == EXPIRED || target == CANCELLED;
            case PLAYER_TURN -> target == RESOLVED || target == EXPIRED || target == CANCELLED;
            case RESOLVED, EXPIRED, CANCELLED -> false;
        };
    }

    public boolean isFinal() {
        return this == RESOLVED || this == EXPIRED || this == CANCELLED;
    }
}
