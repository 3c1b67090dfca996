package kr.socialcredit.economy.infrastructure.discord;

import kr.socialcredit.economy.application.port.in.VoiceActivityUseCase;
import kr.socialcredit.economy.chat.ChatActionDispatcher;
import kr.socialcredit.economy.chat.ChatActionEvent;
import kr.socialcredit.economy.chat.ChatCommandDispatcher;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.events.guild.voice.GuildVoiceUpdateEvent;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * 디스코드 게이트웨이 이벤트 전달
 * - 메시지, 버튼 → 채팅 디스패처
 * - 음성 채널 입장/퇴장 → 음성 보상
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "discord.enabled", havingValue = "true")
public class DiscordEventListener extends ListenerAdapter {

    private final JDA jda;
    private final DiscordProperties properties;
    private final ChatCommandDispatcher commandDispatcher;
    private final ChatActionDispatcher actionDispatcher;
    private final VoiceActivityUseCase voiceActivity;

    @PostConstruct
    void register() {
        jda.addEventListener(this);
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (event.getAuthor().isBot()) {
            return;
        }
        String channelId = event.getChannel().getId();
        if (!properties.getCommandChannelId().equals(channelId)) {
            return;
        }
        commandDispatcher.dispatch(new ChatCommandEvent(
                event.getMessage().getContentRaw(), event.getAuthor().getId(), channelId));
    }

    @Override
    public void onButtonInteraction(ButtonInteractionEvent event) {
        // 3초 안에 응답하지 않으면 상호작용 실패로 표시된다
        event.deferEdit().queue();
        boolean handled = actionDispatcher.dispatch(new ChatActionEvent(
                event.getComponentId(), event.getUser().getId(),
                event.getChannel().getId(), event.getMessageId()));
        if (!handled) {
            log.debug("[디스코드] 처리되지 않은 버튼: {}", event.getComponentId());
        }
    }

    @Override
    public void onGuildVoiceUpdate(GuildVoiceUpdateEvent event) {
        Member member = event.getMember();
        if (member.getUser().isBot()) {
            return;
        }
        if (event.getChannelJoined() != null) {
            voiceActivity.joined(member.getId());
        } else {
            voiceActivity.left(member.getId());
        }
    }
}
