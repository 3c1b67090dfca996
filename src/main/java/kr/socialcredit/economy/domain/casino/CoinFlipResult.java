package kr.socialcredit.economy.domain.casino;

/**
 * 레드블랙 라운드 정산 결과
 */
public record CoinFlipResult(
        String sessionId,
        String playerId,
        CoinSide chosen,
        CoinSide outcome,
        long bet,
        long payout,
        long balanceAfter
) {

    public boolean won() {
        return chosen == outcome;
    }
}
