package kr.socialcredit.economy.infrastructure.persistence.gacha;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import kr.socialcredit.economy.application.port.out.GachaStorePort.DailyAction;
import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.Inventory;
import kr.socialcredit.economy.support.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("가챠 저장소 어댑터 테스트")
class GachaStoreAdapterTest {

    private InMemoryKeyValueStore store;
    private GachaStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        adapter = new GachaStoreAdapter(store, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    @DisplayName("아이템과 케이스 인벤토리는 서로 다른 키에 저장된다")
    void separateKeys() {
        adapter.saveItems("u", Inventory.of(Map.of("c01", 2)));
        adapter.saveContainers("u", Inventory.of(Map.of("origins", 1)));

        assertThat(store.snapshot()).containsKeys("inventory:u", "case_inventory:u");
        assertThat(adapter.loadItems("u").countOf("c01")).isEqualTo(2);
        assertThat(adapter.loadItems("u").countOf("origins")).isZero();
        assertThat(adapter.loadContainers("u").countOf("origins")).isEqualTo(1);
    }

    @Test
    @DisplayName("저장된 인벤토리가 없으면 빈 인벤토리, 0개 항목은 읽을 때 제거된다")
    void emptyAndZeroCounts() {
        store.set("inventory:z", "{\"c01\":0,\"r01\":1}");

        assertThat(adapter.loadItems("nobody").isEmpty()).isTrue();
        assertThat(adapter.loadItems("z").asMap()).containsOnlyKeys("r01");
    }

    @Test
    @DisplayName("손상된 인벤토리는 예외")
    void corruptInventory() {
        store.set("inventory:bad", "[1,2]");

        assertThatThrownBy(() -> adapter.loadItems("bad"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("은행 재고와 마지막 보충 시각을 보존한다")
    void bank() {
        Instant refilledAt = Instant.parse("2024-05-01T00:00:00Z");
        ContainerBank bank = ContainerBank.empty();
        bank.refillIfDue(refilledAt, Duration.ofHours(12), 3, List.of("origins"));
        bank.take("origins");

        adapter.saveBank(bank);
        ContainerBank loaded = adapter.loadBank();

        assertThat(loaded.stockOf("origins")).isEqualTo(2);
        assertThat(loaded.getLastRefilled()).isEqualTo(refilledAt);
        assertThat(loaded.refillIfDue(refilledAt.plusSeconds(60), Duration.ofHours(12), 3, List.of("origins")))
                .isFalse();
    }

    @Test
    @DisplayName("일일 카운터는 날짜와 동작별로 분리되고 처음 증가할 때 24시간 TTL이 붙는다")
    void dailyCounters() {
        LocalDate day = LocalDate.of(2024, 5, 1);

        adapter.incrementDaily(DailyAction.OPEN, "u", day);
        int opens = adapter.incrementDaily(DailyAction.OPEN, "u", day);

        assertThat(opens).isEqualTo(2);
        assertThat(adapter.dailyCount(DailyAction.OPEN, "u", day)).isEqualTo(2);
        assertThat(adapter.dailyCount(DailyAction.PURCHASE, "u", day)).isZero();
        assertThat(adapter.dailyCount(DailyAction.OPEN, "u", day.plusDays(1))).isZero();
        assertThat(store.ttlOf("daily:open:u:2024-05-01")).contains(Duration.ofHours(24));
    }
}
