package kr.socialcredit.economy.domain.gacha;

import java.util.Arrays;

/**
 * 아이템 등급
 * - weight: 추첨 가중치 (정수, 합계 925)
 * - basePrice: 기준 가격 (크레딧)
 * - volatility: 기준 시세 변동이 가격에 반영되는 비율
 */
public enum Rarity {

    COMMON("Common", 500, 10, 0.05),
    RARE("Rare", 250, 25, 0.10),
    SUPER_RARE("Super-rare", 100, 60, 0.20),
    EPIC("Epic", 50, 150, 0.30),
    NEPHRITE("Nephrite", 10, 400, 0.40),
    EXOTIC("Exotic", 10, 800, 0.50),
    LEGENDARY("Legendary", 5, 2000, 0.60);

    private final String label;
    private final int weight;
    private final long basePrice;
    private final double volatility;

    Rarity(String label, int weight, long basePrice, double volatility) {
        this.label = label;
        this.weight = weight;
        this.basePrice = basePrice;
        this.volatility = volatility;
    }

    public static Rarity fromLabel(String label) {
        return Arrays.stream(values())
                .filter(r -> r.label.equalsIgnoreCase(label) || r.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 등급입니다: " + label));
    }

    /**
     * 기준 시세 변동률을 반영한 가격 (최소 1)
     *
     * @param changeRatio (현재 시세 - 24시간 평균) / 24시간 평균
     */
    public long priceAt(double changeRatio) {
        double adjusted = basePrice * (1.0 + volatility * changeRatio);
        return Math.max(1L, Math.round(adjusted));
    }

    public String getLabel() { return label; }
    public int getWeight() { return weight; }
    public long getBasePrice() { return basePrice; }
    public double getVolatility() { return volatility; }
}
