package kr.socialcredit.economy.domain.gacha;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 아이템/케이스 카탈로그 (실행 중 불변)
 */
public class Catalog {

    private final Map<String, Item> items;
    private final Map<String, LootContainer> containers;

    public Catalog(Collection<Item> items, Collection<LootContainer> containers) {
        Map<String, Item> itemMap = new LinkedHashMap<>();
        items.forEach(item -> itemMap.put(item.id(), item));
        Map<String, LootContainer> containerMap = new LinkedHashMap<>();
        containers.forEach(container -> containerMap.put(container.id(), container));
        this.items = Collections.unmodifiableMap(itemMap);
        this.containers = Collections.unmodifiableMap(containerMap);
    }

    public Item item(String itemId) {
        Item item = items.get(itemId);
        if (item == null) {
            throw new ItemNotFoundException(itemId);
        }
        return item;
    }

    public LootContainer container(String containerId) {
        LootContainer container = containers.get(containerId);
        if (container == null) {
            throw new ContainerNotFoundException(containerId);
        }
        return container;
    }

    /**
     * 케이스에서 나올 수 있는 아이템 후보
     */
    public List<Item> poolFor(LootContainer container) {
        return items.values().stream()
                .filter(container::contains)
                .toList();
    }

    public Collection<Item> items() {
        return items.values();
    }

    public Collection<LootContainer> containers() {
        return containers.values();
    }
}
