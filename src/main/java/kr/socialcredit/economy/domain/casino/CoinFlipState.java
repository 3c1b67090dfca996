package kr.socialcredit.economy.domain.casino;

/**
 * 레드블랙 라운드 상태
 */
public enum CoinFlipState {

    AWAITING_BET("베팅 대기"),
    IN_PROGRESS("진행중"),
    RESOLVED("종료"),
    EXPIRED("만료");

    private final String displayName;

    CoinFlipState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(CoinFlipState target) {
        return switch (this) {
            case AWAITING_BET -> target == IN_PROGRESS || target == EXPIRED;
            case IN_PROGRESS -> target == RESOLVED || target == EXPIRED;
            case RESOLVED, EXPIRED -> false;
        };
    }

    public boolean isFinal() {
        return this == RESOLVED || this == EXPIRED;
    }
}
