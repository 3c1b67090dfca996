package kr.socialcredit.economy.infrastructure.persistence.gacha;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.socialcredit.economy.application.port.out.GachaStorePort;
import kr.socialcredit.economy.application.port.out.KeyValueStorePort;
import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.Inventory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

/**
 * 가챠 상태 저장소 어댑터
 * - inventory:{userId}       → {itemId: count}
 * - case_inventory:{userId}  → {containerId: count}
 * - bank:containers          → {stock, lastRefilled}
 * - daily:{action}:{userId}:{yyyy-MM-dd} → 카운터 (TTL 24시간)
 */
@Component
@RequiredArgsConstructor
public class GachaStoreAdapter implements GachaStorePort {

    private static final String ITEM_PREFIX = "inventory:";
    private static final String CONTAINER_PREFIX = "case_inventory:";
    private static final String BANK_KEY = "bank:containers";
    private static final String DAILY_PREFIX = "daily:";
    private static final Duration DAILY_TTL = Duration.ofHours(24);
    private static final TypeReference<Map<String, Integer>> COUNTS = new TypeReference<>() {};

    private final KeyValueStorePort keyValueStore;
    private final ObjectMapper objectMapper;

    @Override
    public Inventory loadItems(String userId) {
        return loadInventory(ITEM_PREFIX + userId);
    }

    @Override
    public void saveItems(String userId, Inventory inventory) {
        keyValueStore.set(ITEM_PREFIX + userId, write(inventory.asMap()));
    }

    @Override
    public Inventory loadContainers(String userId) {
        return loadInventory(CONTAINER_PREFIX + userId);
    }

    @Override
    public void saveContainers(String userId, Inventory inventory) {
        keyValueStore.set(CONTAINER_PREFIX + userId, write(inventory.asMap()));
    }

    @Override
    public ContainerBank loadBank() {
        return keyValueStore.get(BANK_KEY)
                .map(json -> read(json, BankRecord.class).toDomain())
                .orElseGet(ContainerBank::empty);
    }

    @Override
    public void saveBank(ContainerBank bank) {
        keyValueStore.set(BANK_KEY, write(BankRecord.from(bank)));
    }

    @Override
    public int dailyCount(DailyAction action, String userId, LocalDate day) {
        return keyValueStore.get(dailyKey(action, userId, day))
                .map(Integer::parseInt)
                .orElse(0);
    }

    @Override
    public int incrementDaily(DailyAction action, String userId, LocalDate day) {
        return (int) keyValueStore.increment(dailyKey(action, userId, day), DAILY_TTL);
    }

    private String dailyKey(DailyAction action, String userId, LocalDate day) {
        return DAILY_PREFIX + action.getKey() + ":" + userId + ":" + day;
    }

    private Inventory loadInventory(String key) {
        return keyValueStore.get(key)
                .map(json -> Inventory.of(read(json, COUNTS)))
                .orElseGet(Inventory::empty);
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("가챠 레코드 역직렬화 실패: " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("인벤토리 역직렬화 실패", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("가챠 레코드 직렬화 실패", e);
        }
    }
}
