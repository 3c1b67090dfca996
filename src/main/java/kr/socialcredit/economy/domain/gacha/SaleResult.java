package kr.socialcredit.economy.domain.gacha;

/**
 * 판매 정산 결과
 */
public record SaleResult(
        String sellerId,
        Item item,
        int quantity,
        long unitPrice,
        long proceeds,
        long balanceAfter,
        int remaining
) {
}
