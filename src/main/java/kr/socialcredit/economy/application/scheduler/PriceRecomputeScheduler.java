package kr.socialcredit.economy.application.scheduler;

import kr.socialcredit.economy.application.port.in.PricingUseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 아이템 시세 재계산 - 기본 15분마다
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "economy.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PriceRecomputeScheduler {

    private final PricingUseCase pricing;

    @Scheduled(initialDelay = 5000, fixedDelayString = "${economy.pricing.recompute-interval-ms:900000}")
    public void recomputePrices() {
        try {
            pricing.recompute();
        } catch (Exception e) {
            log.error("[시세갱신] 처리 중 오류 발생", e);
        }
    }
}
