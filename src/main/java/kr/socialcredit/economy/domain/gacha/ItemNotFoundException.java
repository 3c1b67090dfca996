package kr.socialcredit.economy.domain.gacha;

public class ItemNotFoundException extends RuntimeException {

    public ItemNotFoundException(String itemId) {
        super("존재하지 않는 아이템입니다: " + itemId);
    }
}
