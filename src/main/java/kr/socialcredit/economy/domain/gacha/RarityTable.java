package kr.socialcredit.economy.domain.gacha;

import kr.socialcredit.economy.domain.common.GameRandom;

import java.util.ArrayList;
import java.util.List;

/**
 * 등급 가중치 표와 누적 가중치 추첨
 *
 * [0, 전체 가중치) 범위에서 균등 난수를 뽑고 등급 순서대로 가중치를 누적해
 * 난수가 속한 구간의 등급을 고른다. 그 등급의 아이템이 후보에 없으면 후보 전체에서 균등 추첨한다.
 */
public class RarityTable {

    public record Entry(Rarity rarity, int weight) {
        public Entry {
            if (weight <= 0) {
                throw new IllegalArgumentException("가중치는 0보다 커야 합니다: " + rarity);
            }
        }
    }

    private final List<Entry> entries;
    private final int totalWeight;

    public RarityTable(List<Entry> entries) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("등급 표가 비어 있습니다");
        }
        this.entries = List.copyOf(entries);
        this.totalWeight = entries.stream().mapToInt(Entry::weight).sum();
    }

    public static RarityTable standard() {
        List<Entry> entries = new ArrayList<>();
        for (Rarity rarity : Rarity.values()) {
            entries.add(new Entry(rarity, rarity.getWeight()));
        }
        return new RarityTable(entries);
    }

    public Rarity sampleRarity(GameRandom random) {
        int u = random.nextInt(totalWeight);
        int cumulative = 0;
        for (Entry entry : entries) {
            cumulative += entry.weight();
            if (u < cumulative) {
                return entry.rarity();
            }
        }
        return entries.get(entries.size() - 1).rarity();
    }

    public Item draw(List<Item> pool, GameRandom random) {
        if (pool.isEmpty()) {
            throw new IllegalArgumentException("추첨할 아이템이 없습니다");
        }
        Rarity rarity = sampleRarity(random);
        List<Item> tier = pool.stream()
                .filter(item -> item.rarity() == rarity)
                .toList();
        List<Item> candidates = tier.isEmpty() ? pool : tier;
        return candidates.get(random.nextInt(candidates.size()));
    }

    public int getTotalWeight() {
        return totalWeight;
    }

    public List<Entry> getEntries() {
        return entries;
    }
}
