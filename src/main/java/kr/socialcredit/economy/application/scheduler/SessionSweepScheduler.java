package kr.socialcredit.economy.application.scheduler;

import kr.socialcredit.economy.application.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료 타이머를 놓친 세션 정리
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "economy.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SessionSweepScheduler {

    private final SessionRegistry sessionRegistry;

    @Scheduled(fixedDelayString = "${economy.session.sweep-interval-ms:30000}")
    public void sweepExpiredSessions() {
        try {
            int expired = sessionRegistry.sweepExpired();
            if (expired > 0) {
                log.info("[세션정리] 만료된 세션 {}건 처리 완료", expired);
            }
        } catch (Exception e) {
            log.error("[세션정리] 처리 중 오류 발생", e);
        }
    }
}
