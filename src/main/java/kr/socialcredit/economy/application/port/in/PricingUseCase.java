package kr.socialcredit.economy.application.port.in;

import java.util.Map;

public interface PricingUseCase {

    record ReferenceSnapshot(double current, double average24h, double changeRatio, int samples) {}

    long priceOf(String itemId);

    Map<String, Long> prices();

    /**
     * 기준 시세를 새로 받아 모든 아이템 가격을 다시 계산
     */
    void recompute();

    ReferenceSnapshot reference();
}
