package kr.socialcredit.economy.infrastructure.messaging;

import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * 채팅 플랫폼 없이 실행할 때 쓰는 메시징 어댑터 (로컬 실행, 테스트)
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "discord.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingMessagingAdapter implements MessagingPort {

    @Override
    public void sendMessage(String channelId, String text) {
        log.info("[메시지] channel={}\n{}", channelId, text);
    }

    @Override
    public String sendMessageWithActions(String channelId, String text, List<MessageAction> actions) {
        String messageId = UUID.randomUUID().toString();
        log.info("[메시지] channel={}, message={}, actions={}\n{}", channelId, messageId, labels(actions), text);
        return messageId;
    }

    @Override
    public void editMessage(String channelId, String messageId, String text, List<MessageAction> actions) {
        log.info("[메시지 수정] channel={}, message={}, actions={}\n{}", channelId, messageId, labels(actions), text);
    }

    private static List<String> labels(List<MessageAction> actions) {
        return actions.stream().map(a -> a.label() + "(" + a.actionId() + ")").toList();
    }
}
