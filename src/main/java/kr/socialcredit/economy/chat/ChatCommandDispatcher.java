package kr.socialcredit.economy.chat;

import kr.socialcredit.economy.application.port.out.MessagingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * '!' 명령을 핸들러로 분배
 * 등록된 명령은 성공이든 실패든 반드시 응답한다.
 */
@Slf4j
@Component
public class ChatCommandDispatcher {

    public static final String PREFIX = "!";

    private final Map<String, ChatCommandHandler> handlers = new HashMap<>();
    private final MessagingPort messagingPort;
    private final ChatErrorTranslator errorTranslator;

    public ChatCommandDispatcher(List<ChatCommandHandler> handlers, MessagingPort messagingPort,
                                 ChatErrorTranslator errorTranslator) {
        this.messagingPort = messagingPort;
        this.errorTranslator = errorTranslator;
        for (ChatCommandHandler handler : handlers) {
            for (String command : handler.commands()) {
                ChatCommandHandler previous = this.handlers.put(command, handler);
                if (previous != null) {
                    throw new IllegalStateException("중복 등록된 명령입니다: " + command);
                }
            }
        }
    }

    /**
     * @return 처리한 명령이면 true
     */
    public boolean dispatch(ChatCommandEvent event) {
        String text = event.commandText() == null ? "" : event.commandText().trim();
        if (!text.startsWith(PREFIX) || text.length() == PREFIX.length()) {
            return false;
        }

        List<String> tokens = Arrays.asList(text.substring(PREFIX.length()).split("\\s+"));
        String command = tokens.get(0).toLowerCase(Locale.ROOT);
        ChatCommandHandler handler = handlers.get(command);
        if (handler == null) {
            return false;
        }

        log.debug("[채팅] 명령 수신: command={}, author={}, channel={}", command, event.authorId(), event.channelId());
        try {
            handler.handle(command, tokens.subList(1, tokens.size()), event);
        } catch (Exception e) {
            reply(event.channelId(), errorTranslator.translate(e, command));
        }
        return true;
    }

    private void reply(String channelId, String text) {
        try {
            messagingPort.sendMessage(channelId, text);
        } catch (Exception e) {
            log.error("[채팅] 오류 응답 전송 실패: channel={}", channelId, e);
        }
    }
}
