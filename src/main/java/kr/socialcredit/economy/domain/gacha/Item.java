package kr.socialcredit.economy.domain.gacha;

import java.util.Objects;

/**
 * 수집 아이템
 */
public record Item(String id, String name, Rarity rarity, String collection) {

    public Item {
        Objects.requireNonNull(id, "아이템 ID는 필수입니다");
        Objects.requireNonNull(rarity, "등급은 필수입니다");
        name = name == null ? id : name;
    }
}
