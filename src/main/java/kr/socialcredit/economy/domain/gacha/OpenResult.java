package kr.socialcredit.economy.domain.gacha;

import java.util.List;

/**
 * 케이스 개봉 결과
 */
public record OpenResult(
        String userId,
        LootContainer container,
        List<DrawResult> draws,
        int opensToday,
        int remainingContainers
) {
}
