package kr.socialcredit.economy.domain.duel;

/**
 * 결투 정산 결과
 */
public record DuelOutcome(
        String sessionId,
        String winnerId,
        String loserId,
        long bet,
        long payout,
        long winnerBalance,
        long loserBalance
) {
}
