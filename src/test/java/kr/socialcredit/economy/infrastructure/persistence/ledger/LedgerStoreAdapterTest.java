package kr.socialcredit.economy.infrastructure.persistence.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.domain.account.GameType;
import kr.socialcredit.economy.support.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("원장 저장소 어댑터 테스트")
class LedgerStoreAdapterTest {

    private InMemoryKeyValueStore store;
    private LedgerStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        adapter = new LedgerStoreAdapter(store, new ObjectMapper());
    }

    @Test
    @DisplayName("계정은 user:{id} 키에 저장되고 통계와 함께 복원된다")
    void saveAndFind() {
        // given
        Account account = Account.open("u1");
        account.applyDelta(300L);
        account.recordGame(GameType.DUEL, true);
        account.recordGame(GameType.DUEL, false);

        // when
        adapter.save(account);
        Account loaded = adapter.findById("u1").orElseThrow();

        // then
        assertThat(store.snapshot()).containsKey("user:u1");
        assertThat(loaded.getBalance()).isEqualTo(300L);
        assertThat(loaded.statsOf(GameType.DUEL).played()).isEqualTo(2);
        assertThat(loaded.statsOf(GameType.DUEL).won()).isEqualTo(1);
    }

    @Test
    @DisplayName("예전 형식의 rating 필드와 id 누락을 허용한다")
    void legacyRecord() {
        store.set("user:old", "{\"rating\":120,\"duelsPlayed\":3,\"duelsWon\":2,\"unknown\":true}");

        Account loaded = adapter.findById("old").orElseThrow();

        assertThat(loaded.getId()).isEqualTo("old");
        assertThat(loaded.getBalance()).isEqualTo(120L);
        assertThat(loaded.statsOf(GameType.DUEL).won()).isEqualTo(2);
    }

    @Test
    @DisplayName("음성 체류 시간이 저장되고, 필드가 없는 예전 레코드는 0으로 읽는다")
    void voiceSeconds() {
        // given
        Account account = Account.open("u1");
        account.addVoiceSeconds(125L);
        store.set("user:old", "{\"id\":\"old\",\"balance\":10}");

        // when
        adapter.save(account);

        // then
        assertThat(store.snapshot().get("user:u1")).contains("\"voiceSeconds\":125");
        assertThat(adapter.findById("u1").orElseThrow().getVoiceSeconds()).isEqualTo(125L);
        assertThat(adapter.findById("old").orElseThrow().getVoiceSeconds()).isZero();
    }

    @Test
    @DisplayName("음수 잔액 레코드는 0으로 읽는다")
    void negativeBalanceClamped() {
        store.set("user:neg", "{\"id\":\"neg\",\"balance\":-50}");

        assertThat(adapter.findById("neg").orElseThrow().getBalance()).isZero();
    }

    @Test
    @DisplayName("손상된 레코드는 단건 조회 시 예외, 전체 조회 시 건너뛴다")
    void corruptRecord() {
        store.set("user:ok", "{\"id\":\"ok\",\"balance\":10}");
        store.set("user:bad", "not-json");

        assertThatThrownBy(() -> adapter.findById("bad"))
                .isInstanceOf(IllegalStateException.class);

        List<Account> all = adapter.findAll();
        assertThat(all).extracting(Account::getId).containsExactly("ok");
    }

    @Test
    @DisplayName("없는 계정은 empty")
    void missing() {
        assertThat(adapter.findById("ghost")).isEmpty();
    }
}
