package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.PricingUseCase;
import kr.socialcredit.economy.application.port.out.PriceFeedPort;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.Item;
import kr.socialcredit.economy.domain.gacha.ReferencePriceHistory;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 아이템 시세 서비스
 * 가격 = max(1, round(기준가 × (1 + 변동성 × (현재 시세 - 24시간 평균) / 24시간 평균)))
 * 시세 피드가 없으면 기준가를 그대로 쓴다.
 */
@Slf4j
@Service
public class ItemPricingService implements PricingUseCase {

    private final Catalog catalog;
    private final PriceFeedPort priceFeed;
    private final Clock clock;
    private final ReferencePriceHistory history;

    private volatile Map<String, Long> prices;

    public ItemPricingService(Catalog catalog, PriceFeedPort priceFeed, Clock clock, EconomyProperties properties) {
        this.catalog = catalog;
        this.priceFeed = priceFeed;
        this.clock = clock;
        this.history = new ReferencePriceHistory(properties.getPricing().getSampleWindow());
        this.prices = computePrices(0.0);
    }

    @Override
    public long priceOf(String itemId) {
        Item item = catalog.item(itemId);
        return prices.getOrDefault(itemId, item.rarity().getBasePrice());
    }

    @Override
    public Map<String, Long> prices() {
        return prices;
    }

    @Override
    public void recompute() {
        priceFeed.fetchCurrentPrice()
                .ifPresent(price -> history.record(clock.instant(), price));
        double changeRatio = history.changeRatio();
        this.prices = computePrices(changeRatio);
        log.info("[시세] 아이템 가격 재계산 완료: items={}, reference={}, change={}",
                prices.size(), history.current(), String.format("%.4f", changeRatio));
    }

    @Override
    public ReferenceSnapshot reference() {
        return new ReferenceSnapshot(history.current(), history.average(), history.changeRatio(), history.size());
    }

    private Map<String, Long> computePrices(double changeRatio) {
        Map<String, Long> computed = new LinkedHashMap<>();
        for (Item item : catalog.items()) {
            computed.put(item.id(), item.rarity().priceAt(changeRatio));
        }
        return Collections.unmodifiableMap(computed);
    }
}
