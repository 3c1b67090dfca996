package kr.socialcredit.economy.application.event;

import kr.socialcredit.economy.domain.session.SessionKind;

import java.time.Instant;
import java.util.Map;

/**
 * 세션 타임아웃 종료 이벤트
 */
public record SessionExpiredEvent(
        String sessionId,
        SessionKind kind,
        String ownerId,
        String channelId,
        String messageId,
        Map<String, Long> refunds,
        Instant expiredAt
) {
}
