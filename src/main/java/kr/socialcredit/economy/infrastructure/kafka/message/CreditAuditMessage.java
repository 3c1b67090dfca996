package kr.socialcredit.economy.infrastructure.kafka.message;

import kr.socialcredit.economy.application.event.CreditAdjustedEvent;
import kr.socialcredit.economy.application.event.LedgerWriteFailedEvent;

import java.time.Instant;

/**
 * 크레딧 감사 로그 메시지 (credit-audit 토픽)
 */
public record CreditAuditMessage(
        String eventType,
        String userId,
        Long oldBalance,
        Long newBalance,
        long delta,
        String reason,
        String error,
        Instant occurredAt
) {
    public static CreditAuditMessage adjusted(CreditAdjustedEvent event) {
        return new CreditAuditMessage(
                "CREDIT_ADJUSTED",
                event.userId(),
                event.oldBalance(),
                event.newBalance(),
                event.delta(),
                event.reason(),
                null,
                event.occurredAt()
        );
    }

    public static CreditAuditMessage writeFailed(LedgerWriteFailedEvent event) {
        return new CreditAuditMessage(
                "LEDGER_WRITE_FAILED",
                event.userId(),
                null,
                null,
                event.delta(),
                event.reason(),
                event.error(),
                event.occurredAt()
        );
    }
}
