package kr.socialcredit.economy.application.event;

import java.time.Instant;

/**
 * 잔액 변경 감사 이벤트
 */
public record CreditAdjustedEvent(
        String userId,
        long oldBalance,
        long newBalance,
        long delta,
        String reason,
        Instant occurredAt
) {
    public static CreditAdjustedEvent of(String userId, long oldBalance, long newBalance,
                                         long delta, String reason, Instant occurredAt) {
        return new CreditAdjustedEvent(userId, oldBalance, newBalance, delta, reason, occurredAt);
    }
}
