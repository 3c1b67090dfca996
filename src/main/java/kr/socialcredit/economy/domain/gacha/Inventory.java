package kr.socialcredit.economy.domain.gacha;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 사용자 보유 수량 (아이템 또는 케이스 ID → 개수)
 * 개수가 0이 되면 항목을 제거한다.
 */
public class Inventory {

    private final Map<String, Integer> counts;

    private Inventory(Map<String, Integer> counts) {
        this.counts = new TreeMap<>();
        counts.forEach((id, count) -> {
            if (count != null && count > 0) {
                this.counts.put(id, count);
            }
        });
    }

    public static Inventory empty() {
        return new Inventory(Map.of());
    }

    public static Inventory of(Map<String, Integer> counts) {
        return new Inventory(counts);
    }

    public void add(String id, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("수량은 0보다 커야 합니다");
        }
        counts.merge(id, quantity, Integer::sum);
    }

    public void remove(String id, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("수량은 0보다 커야 합니다");
        }
        int held = countOf(id);
        if (held < quantity) {
            throw InsufficientInventoryException.of(id, quantity, held);
        }
        if (held == quantity) {
            counts.remove(id);
        } else {
            counts.put(id, held - quantity);
        }
    }

    public int countOf(String id) {
        return counts.getOrDefault(id, 0);
    }

    public boolean contains(String id) {
        return countOf(id) > 0;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }
}
