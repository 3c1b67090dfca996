package kr.socialcredit.economy.domain.account;

/**
 * 전적을 집계하는 게임 종류
 */
public enum GameType {

    DUEL("결투"),
    COIN_FLIP("레드블랙"),
    BLACKJACK("블랙잭");

    private final String displayName;

    GameType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
