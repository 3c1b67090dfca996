package kr.socialcredit.economy.domain.duel;

import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.SelfInteractionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("결투 세션 상태 전이 테스트")
class DuelSessionTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private DuelSession open() {
        return DuelSession.open("d-1", "alice", "ch", 100L, NOW, Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("생성 시각 + TTL 에 만료된다")
    void expiresAt() {
        DuelSession session = open();

        assertThat(session.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(session.isExpiredAt(NOW.plus(Duration.ofMinutes(14)))).isFalse();
        assertThat(session.isExpiredAt(NOW.plus(Duration.ofMinutes(15)))).isTrue();
    }

    @Test
    @DisplayName("수락 후에는 다시 수락할 수 없다")
    void claim_Once() {
        DuelSession session = open();
        session.claim("bob");

        assertThat(session.getState()).isEqualTo(DuelState.ACCEPTED);
        assertThat(session.isClaimable()).isFalse();
        assertThatThrownBy(() -> session.claim("carol"))
                .isInstanceOf(InvalidSessionStateException.class);
    }

    @Test
    @DisplayName("자기 결투는 수락할 수 없다")
    void claim_Self() {
        assertThatThrownBy(() -> open().claim("alice"))
                .isInstanceOf(SelfInteractionException.class);
    }

    @Test
    @DisplayName("수락 전 만료는 도전자 베팅 환불, 수락 후 만료는 환불 없음")
    void expire() {
        DuelSession waiting = open();
        assertThat(waiting.expire()).isEqualTo(Map.of("alice", 100L));
        assertThat(waiting.isActive()).isFalse();

        DuelSession accepted = open();
        accepted.claim("bob");
        assertThat(accepted.expire()).isEmpty();
    }

    @Test
    @DisplayName("패자는 승자가 아닌 참가자")
    void loserOf() {
        DuelSession session = open();
        session.claim("bob");

        assertThat(session.loserOf("alice")).isEqualTo("bob");
        assertThat(session.loserOf("bob")).isEqualTo("alice");
    }

    @Test
    @DisplayName("참가자가 아닌 사용자는 승자가 될 수 없다")
    void resolve_NonParticipant() {
        DuelSession session = open();
        session.claim("bob");

        assertThatThrownBy(() -> session.resolve("mallory"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
