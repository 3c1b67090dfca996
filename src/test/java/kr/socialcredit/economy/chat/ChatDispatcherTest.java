package kr.socialcredit.economy.chat;

import kr.socialcredit.economy.domain.account.InsufficientBalanceException;
import kr.socialcredit.economy.support.RecordingMessagingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("채팅 명령/버튼 분배 테스트")
class ChatDispatcherTest {

    private RecordingMessagingPort messagingPort;
    private final List<String> received = new ArrayList<>();

    private final ChatCommandHandler echo = new ChatCommandHandler() {
        @Override
        public Set<String> commands() {
            return Set.of("echo", "fail");
        }

        @Override
        public void handle(String command, List<String> args, ChatCommandEvent event) {
            if (command.equals("fail")) {
                throw InsufficientBalanceException.of(100L, 5L);
            }
            received.add(command + ":" + String.join(",", args));
        }
    };

    private final ChatActionHandler clicker = new ChatActionHandler() {
        @Override
        public Set<String> actions() {
            return Set.of("press");
        }

        @Override
        public void handle(String action, String payload, ChatActionEvent event) {
            if (payload.equals("boom")) {
                throw new IllegalStateException("boom");
            }
            received.add(action + "@" + payload);
        }
    };

    @BeforeEach
    void setUp() {
        messagingPort = new RecordingMessagingPort();
    }

    private ChatCommandDispatcher commands() {
        return new ChatCommandDispatcher(List.of(echo), messagingPort, new ChatErrorTranslator());
    }

    private ChatActionDispatcher actions() {
        return new ChatActionDispatcher(List.of(clicker), messagingPort, new ChatErrorTranslator());
    }

    @Test
    @DisplayName("명령 이름은 대소문자를 가리지 않고 인자는 공백으로 나눈다")
    void dispatchCommand() {
        boolean handled = commands().dispatch(new ChatCommandEvent("!ECHO  a   b", "u1", "ch"));

        assertThat(handled).isTrue();
        assertThat(received).containsExactly("echo:a,b");
    }

    @Test
    @DisplayName("접두사가 없거나 등록되지 않은 명령은 무시한다")
    void ignoresUnknown() {
        ChatCommandDispatcher dispatcher = commands();

        assertThat(dispatcher.dispatch(new ChatCommandEvent("echo a", "u1", "ch"))).isFalse();
        assertThat(dispatcher.dispatch(new ChatCommandEvent("!", "u1", "ch"))).isFalse();
        assertThat(dispatcher.dispatch(new ChatCommandEvent("!nope", "u1", "ch"))).isFalse();
        assertThat(messagingPort.sent()).isEmpty();
    }

    @Test
    @DisplayName("처리 중 실패하면 사용자에게 이유를 응답한다")
    void repliesOnFailure() {
        commands().dispatch(new ChatCommandEvent("!fail", "u1", "ch"));

        assertThat(messagingPort.lastSent().channelId()).isEqualTo("ch");
        assertThat(messagingPort.lastSent().text()).startsWith("❌");
    }

    @Test
    @DisplayName("같은 명령을 두 핸들러가 등록하면 시작할 수 없다")
    void duplicateCommand() {
        assertThatThrownBy(() -> new ChatCommandDispatcher(List.of(echo, echo), messagingPort, new ChatErrorTranslator()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("버튼 ID의 동작과 값을 나눠 전달한다")
    void dispatchAction() {
        boolean handled = actions().dispatch(new ChatActionEvent(ActionIds.of("press", "s-1:x"), "u1", "ch", "m1"));

        assertThat(handled).isTrue();
        assertThat(received).containsExactly("press@s-1:x");
        assertThat(actions().dispatch(new ChatActionEvent("other:1", "u1", "ch", "m1"))).isFalse();
    }

    @Test
    @DisplayName("버튼 처리 실패는 누른 사람을 멘션해 알린다")
    void actionFailure() {
        actions().dispatch(new ChatActionEvent("press:boom", "u1", "ch", "m1"));

        assertThat(messagingPort.lastSent().text()).startsWith("<@u1> ❌");
    }
}
