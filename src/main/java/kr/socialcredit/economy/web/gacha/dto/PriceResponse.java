package kr.socialcredit.economy.web.gacha.dto;

import java.util.List;

public record PriceResponse(
        double referencePrice,
        double average24h,
        double changeRatio,
        List<ItemPrice> items
) {

    public record ItemPrice(String itemId, String name, String rarity, long price) {}
}
