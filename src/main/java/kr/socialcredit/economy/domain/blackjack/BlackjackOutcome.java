package kr.socialcredit.economy.domain.blackjack;

/**
 * 블랙잭 판정
 */
public enum BlackjackOutcome {

    PLAYER_BUST("버스트", false),
    DEALER_BUST("딜러 버스트", true),
    PLAYER_WIN("승리", true),
    PUSH("무승부", false),
    DEALER_WIN("패배", false);

    private final String displayName;
    private final boolean playerWon;

    BlackjackOutcome(String displayName, boolean playerWon) {
        this.displayName = displayName;
        this.playerWon = playerWon;
    }

    /**
     * 베팅 대비 지급 배수 (승리 2배, 무승부 환불)
     */
    public long payoutFor(long bet) {
        if (playerWon) {
            return bet * 2;
        }
        return this == PUSH ? bet : 0L;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isPlayerWon() {
        return playerWon;
    }
}
