package kr.socialcredit.economy.domain.gacha;

import java.util.Objects;
import java.util.Set;

/**
 * 케이스: 열면 포함된 컬렉션의 아이템이 나온다.
 */
public record LootContainer(String id, String name, Set<String> collections, long price) {

    public LootContainer {
        Objects.requireNonNull(id, "케이스 ID는 필수입니다");
        collections = Set.copyOf(collections);
        if (price < 0) {
            throw new IllegalArgumentException("케이스 가격은 0 이상이어야 합니다");
        }
        name = name == null ? id : name;
    }

    public boolean contains(Item item) {
        return collections.contains(item.collection());
    }
}
