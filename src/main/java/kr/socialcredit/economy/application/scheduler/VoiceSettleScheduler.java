package kr.socialcredit.economy.application.scheduler;

import kr.socialcredit.economy.application.port.in.VoiceActivityUseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 음성 채널 체류 시간 정기 정산
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "economy.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class VoiceSettleScheduler {

    private final VoiceActivityUseCase voiceActivity;

    @Scheduled(fixedDelayString = "${economy.voice.settle-interval-ms:60000}")
    public void settleVoiceActivity() {
        try {
            int settled = voiceActivity.settleAll();
            if (settled > 0) {
                log.debug("[음성정산] {}명 반영", settled);
            }
        } catch (Exception e) {
            log.error("[음성정산] 처리 중 오류 발생", e);
        }
    }
}
