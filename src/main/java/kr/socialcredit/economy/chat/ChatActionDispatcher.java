package kr.socialcredit.economy.chat;

import kr.socialcredit.economy.application.port.out.MessagingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 버튼 클릭을 핸들러로 분배
 */
@Slf4j
@Component
public class ChatActionDispatcher {

    private final Map<String, ChatActionHandler> handlers = new HashMap<>();
    private final MessagingPort messagingPort;
    private final ChatErrorTranslator errorTranslator;

    public ChatActionDispatcher(List<ChatActionHandler> handlers, MessagingPort messagingPort,
                                ChatErrorTranslator errorTranslator) {
        this.messagingPort = messagingPort;
        this.errorTranslator = errorTranslator;
        for (ChatActionHandler handler : handlers) {
            for (String action : handler.actions()) {
                ChatActionHandler previous = this.handlers.put(action, handler);
                if (previous != null) {
                    throw new IllegalStateException("중복 등록된 버튼 동작입니다: " + action);
                }
            }
        }
    }

    /**
     * @return 처리한 버튼이면 true
     */
    public boolean dispatch(ChatActionEvent event) {
        if (event.actionId() == null) {
            return false;
        }
        String action = ActionIds.actionOf(event.actionId());
        ChatActionHandler handler = handlers.get(action);
        if (handler == null) {
            log.debug("[채팅] 알 수 없는 버튼: {}", event.actionId());
            return false;
        }

        log.debug("[채팅] 버튼 수신: action={}, actor={}, message={}", event.actionId(), event.actorId(), event.sourceMessageId());
        try {
            handler.handle(action, ActionIds.payloadOf(event.actionId()), event);
        } catch (Exception e) {
            String text = ChatArguments.mention(event.actorId()) + " " + errorTranslator.translate(e, action);
            try {
                messagingPort.sendMessage(event.channelId(), text);
            } catch (Exception sendFailure) {
                log.error("[채팅] 오류 응답 전송 실패: channel={}", event.channelId(), sendFailure);
            }
        }
        return true;
    }
}
