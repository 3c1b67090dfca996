package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.event.CreditAdjustedEvent;
import kr.socialcredit.economy.support.EconomyFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("음성 활동 보상 서비스 테스트")
class VoiceActivityServiceTest {

    private EconomyFixture fixture;
    private VoiceActivityService voiceActivity;

    @BeforeEach
    void setUp() {
        fixture = new EconomyFixture();
        voiceActivity = fixture.voiceActivityService();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("정산하면 체류 시간이 쌓이고 1분마다 1크레딧을 받는다")
    void settle() {
        // given
        voiceActivity.joined("u1");
        fixture.clock.advance(Duration.ofSeconds(125));

        // when
        int settled = voiceActivity.settleAll();

        // then
        assertThat(settled).isEqualTo(1);
        assertThat(fixture.balanceOf("u1")).isEqualTo(2L);
        assertThat(fixture.ledger.account("u1").getVoiceSeconds()).isEqualTo(125L);
        List<CreditAdjustedEvent> events = fixture.events.eventsOf(CreditAdjustedEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).delta()).isEqualTo(2L);
        assertThat(events.get(0).reason()).isEqualTo("음성 활동 보상");
    }

    @Test
    @DisplayName("1분이 안 되는 체류를 여러 번 정산해도 합쳐서 1분이 되면 보상한다")
    void partialMinutesAccumulate() {
        voiceActivity.joined("u1");

        fixture.clock.advance(Duration.ofSeconds(40));
        voiceActivity.settleAll();
        assertThat(fixture.balanceOf("u1")).isZero();

        fixture.clock.advance(Duration.ofSeconds(40));
        voiceActivity.settleAll();

        assertThat(fixture.balanceOf("u1")).isEqualTo(1L);
        assertThat(fixture.ledger.account("u1").getVoiceSeconds()).isEqualTo(80L);
    }

    @Test
    @DisplayName("채널 이동으로 다시 입장해도 체류 시간이 초기화되지 않는다")
    void rejoinKeepsPresence() {
        voiceActivity.joined("u1");
        fixture.clock.advance(Duration.ofSeconds(30));
        voiceActivity.joined("u1");
        fixture.clock.advance(Duration.ofSeconds(30));

        voiceActivity.settleAll();

        assertThat(fixture.balanceOf("u1")).isEqualTo(1L);
        assertThat(voiceActivity.trackedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("퇴장하면 남은 시간을 정산하고 추적을 멈춘다")
    void leaveSettlesAndStops() {
        // given
        voiceActivity.joined("u1");
        fixture.clock.advance(Duration.ofSeconds(90));

        // when
        voiceActivity.left("u1");
        fixture.clock.advance(Duration.ofMinutes(10));

        // then
        assertThat(voiceActivity.trackedCount()).isZero();
        assertThat(voiceActivity.settleAll()).isZero();
        assertThat(fixture.balanceOf("u1")).isEqualTo(1L);
        assertThat(fixture.ledger.account("u1").getVoiceSeconds()).isEqualTo(90L);
    }

    @Test
    @DisplayName("추적하지 않는 사용자의 퇴장은 무시한다")
    void leaveUnknown() {
        voiceActivity.left("ghost");

        assertThat(fixture.store.snapshot()).doesNotContainKey("user:ghost");
    }

    @Test
    @DisplayName("저장에 실패한 몫은 다음 정산에 포함된다")
    void failedSettlementRetried() {
        // given
        voiceActivity.joined("u1");
        fixture.clock.advance(Duration.ofSeconds(60));
        fixture.store.failWritesFor("user:");

        // when
        int failedRound = voiceActivity.settleAll();
        fixture.store.failWritesFor(null);
        fixture.clock.advance(Duration.ofSeconds(60));
        int retryRound = voiceActivity.settleAll();

        // then
        assertThat(failedRound).isZero();
        assertThat(retryRound).isEqualTo(1);
        assertThat(fixture.balanceOf("u1")).isEqualTo(2L);
        assertThat(fixture.ledger.account("u1").getVoiceSeconds()).isEqualTo(120L);
    }
}
