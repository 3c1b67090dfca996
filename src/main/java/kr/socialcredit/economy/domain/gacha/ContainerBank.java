package kr.socialcredit.economy.domain.gacha;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모든 사용자가 공유하는 케이스 재고
 * 주기가 지나면 다음 접근 시점에 고정 수량으로 채운다 (백그라운드 타이머 없음).
 */
public class ContainerBank {

    private final Map<String, Integer> stock;
    private Instant lastRefilled;

    private ContainerBank(Map<String, Integer> stock, Instant lastRefilled) {
        this.stock = new LinkedHashMap<>(stock);
        this.lastRefilled = lastRefilled;
    }

    public static ContainerBank restore(Map<String, Integer> stock, Instant lastRefilled) {
        return new ContainerBank(stock, lastRefilled);
    }

    public static ContainerBank empty() {
        return new ContainerBank(Map.of(), null);
    }

    /**
     * 마지막 보충 이후 주기가 지났으면 모든 케이스를 quantity로 채움
     *
     * @return 보충했으면 true
     */
    public boolean refillIfDue(Instant now, Duration interval, int quantity,
                               Collection<String> containerIds) {
        if (lastRefilled != null && now.isBefore(lastRefilled.plus(interval))) {
            return false;
        }
        containerIds.forEach(id -> stock.put(id, quantity));
        this.lastRefilled = now;
        return true;
    }

    public void take(String containerId) {
        int remaining = stockOf(containerId);
        if (remaining <= 0) {
            throw new OutOfStockException(containerId);
        }
        stock.put(containerId, remaining - 1);
    }

    /**
     * 실패한 구매의 재고를 되돌림
     */
    public void putBack(String containerId) {
        stock.merge(containerId, 1, Integer::sum);
    }

    public int stockOf(String containerId) {
        return stock.getOrDefault(containerId, 0);
    }

    public Map<String, Integer> getStock() {
        return Collections.unmodifiableMap(stock);
    }

    public Instant getLastRefilled() {
        return lastRefilled;
    }
}
