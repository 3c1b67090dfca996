package kr.socialcredit.economy.domain.gacha;

/**
 * 추첨된 아이템 한 개. firstAcquisition은 처음 얻은 아이템 표시용.
 */
public record DrawResult(Item item, boolean firstAcquisition) {
}
