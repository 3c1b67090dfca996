package kr.socialcredit.economy.domain.session;

/**
 * 세션 종류
 */
public enum SessionKind {

    DUEL("결투"),
    COIN_FLIP("레드블랙"),
    BLACKJACK("블랙잭"),
    SALE("판매 확인");

    private final String displayName;

    SessionKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
