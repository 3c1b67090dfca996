package kr.socialcredit.economy.infrastructure.discord;

import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import lombok.RequiredArgsConstructor;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.interactions.components.ActionRow;
import net.dv8tion.jda.api.interactions.components.buttons.Button;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JDA 기반 메시징 어댑터
 * 메시지 ID가 필요한 전송은 complete()로 동기 대기하고, 나머지는 queue()로 비동기 전송한다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "discord.enabled", havingValue = "true")
public class DiscordMessagingAdapter implements MessagingPort {

    private static final int MAX_BUTTONS_PER_ROW = 5;

    private final JDA jda;

    @Override
    public void sendMessage(String channelId, String text) {
        channel(channelId).sendMessage(text).queue();
    }

    @Override
    public String sendMessageWithActions(String channelId, String text, List<MessageAction> actions) {
        return channel(channelId).sendMessage(text)
                .setComponents(rows(actions))
                .complete()
                .getId();
    }

    @Override
    public void editMessage(String channelId, String messageId, String text, List<MessageAction> actions) {
        channel(channelId).editMessageById(messageId, text)
                .setComponents(rows(actions))
                .queue();
    }

    private MessageChannel channel(String channelId) {
        MessageChannel channel = jda.getChannelById(MessageChannel.class, channelId);
        if (channel == null) {
            throw new IllegalArgumentException("채널을 찾을 수 없습니다: " + channelId);
        }
        return channel;
    }

    static List<ActionRow> rows(List<MessageAction> actions) {
        if (actions == null || actions.isEmpty()) {
            return List.of();
        }
        List<Button> buttons = actions.stream().map(DiscordMessagingAdapter::toButton).toList();
        List<ActionRow> rows = new ArrayList<>();
        for (int i = 0; i < buttons.size(); i += MAX_BUTTONS_PER_ROW) {
            rows.add(ActionRow.of(buttons.subList(i, Math.min(i + MAX_BUTTONS_PER_ROW, buttons.size()))));
        }
        return rows;
    }

    private static Button toButton(MessageAction action) {
        return switch (action.style()) {
            case PRIMARY -> Button.primary(action.actionId(), action.label());
            case SECONDARY -> Button.secondary(action.actionId(), action.label());
            case SUCCESS -> Button.success(action.actionId(), action.label());
            case DANGER -> Button.danger(action.actionId(), action.label());
        };
    }
}
