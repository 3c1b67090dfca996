package kr.socialcredit.economy.application.event;

import java.time.Instant;

/**
 * 원장 갱신 최종 실패 (운영자 알림 대상)
 */
public record LedgerWriteFailedEvent(
        String userId,
        long delta,
        String reason,
        String error,
        Instant occurredAt
) {
}
