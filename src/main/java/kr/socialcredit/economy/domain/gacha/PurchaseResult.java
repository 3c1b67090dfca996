package kr.socialcredit.economy.domain.gacha;

/**
 * 은행에서 케이스 구매 결과
 */
public record PurchaseResult(
        String userId,
        LootContainer container,
        long pricePaid,
        long balanceAfter,
        int bankStockAfter,
        int purchasesToday
) {
}
