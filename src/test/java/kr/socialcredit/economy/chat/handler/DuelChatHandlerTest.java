package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.chat.ActionIds;
import kr.socialcredit.economy.chat.ChatActionEvent;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.domain.session.Session;
import kr.socialcredit.economy.support.EconomyFixture;
import kr.socialcredit.economy.support.RecordingMessagingPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("결투 채팅 핸들러 테스트")
class DuelChatHandlerTest {

    private EconomyFixture fixture;
    private RecordingMessagingPort messagingPort;
    private DuelChatHandler handler;

    @BeforeEach
    void setUp() {
        fixture = new EconomyFixture();
        messagingPort = new RecordingMessagingPort();
        handler = new DuelChatHandler(fixture.duelService(), fixture.registry, messagingPort);
        fixture.seed("11111", 500L);
        fixture.seed("22222", 500L);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("결투 신청 메시지에 수락 버튼이 붙고 세션에 메시지가 연결된다")
    void challenge() {
        // when
        handler.handle("duel", List.of("100"), new ChatCommandEvent("!duel 100", "11111", "ch"));

        // then
        RecordingMessagingPort.Sent sent = messagingPort.lastSent();
        assertThat(sent.text()).contains("<@11111>").contains("100");
        assertThat(sent.actions()).hasSize(1);
        MessageAction accept = sent.actions().get(0);
        assertThat(accept.style()).isEqualTo(MessageAction.Style.DANGER);
        assertThat(ActionIds.actionOf(accept.actionId())).isEqualTo(ActionIds.DUEL_ACCEPT);

        Session session = fixture.registry.find(ActionIds.payloadOf(accept.actionId())).orElseThrow();
        assertThat(session.getMessageId()).isEqualTo(sent.messageId());
        assertThat(fixture.balanceOf("11111")).isEqualTo(400L);
    }

    @Test
    @DisplayName("수락하면 원래 메시지를 결과로 바꾸고 버튼을 없앤다")
    void accept() {
        handler.handle("duel", List.of("100"), new ChatCommandEvent("!duel 100", "11111", "ch"));
        RecordingMessagingPort.Sent sent = messagingPort.lastSent();
        String payload = ActionIds.payloadOf(sent.actions().get(0).actionId());

        handler.handle(ActionIds.DUEL_ACCEPT, payload,
                new ChatActionEvent(sent.actions().get(0).actionId(), "22222", "ch", sent.messageId()));

        RecordingMessagingPort.Edited edited = messagingPort.lastEdited();
        assertThat(edited.messageId()).isEqualTo(sent.messageId());
        assertThat(edited.actions()).isEmpty();
        assertThat(edited.text()).contains("승자").contains("<@11111>");
        assertThat(fixture.balanceOf("11111") + fixture.balanceOf("22222")).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("인자가 없으면 사용법 안내")
    void usage() {
        assertThatThrownBy(() -> handler.handle("duel", List.of(), new ChatCommandEvent("!duel", "11111", "ch")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("!duel");
    }
}
