package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.in.DuelUseCase;
import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.application.service.SessionRegistry;
import kr.socialcredit.economy.chat.ActionIds;
import kr.socialcredit.economy.chat.ChatActionEvent;
import kr.socialcredit.economy.chat.ChatActionHandler;
import kr.socialcredit.economy.chat.ChatArguments;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.chat.ChatCommandHandler;
import kr.socialcredit.economy.domain.duel.DuelOutcome;
import kr.socialcredit.economy.domain.duel.DuelSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static kr.socialcredit.economy.chat.ChatArguments.mention;

/**
 * !duel 금액 / [결투 수락] 버튼
 */
@Component
@RequiredArgsConstructor
public class DuelChatHandler implements ChatCommandHandler, ChatActionHandler {

    private final DuelUseCase duelUseCase;
    private final SessionRegistry sessionRegistry;
    private final MessagingPort messagingPort;

    @Override
    public Set<String> commands() {
        return Set.of("duel");
    }

    @Override
    public Set<String> actions() {
        return Set.of(ActionIds.DUEL_ACCEPT);
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("사용법: `!duel 금액`");
        }
        long bet = ChatArguments.amount(args.get(0));
        DuelSession session = duelUseCase.challenge(event.authorId(), event.channelId(), bet);

        String text = String.format("⚔️ %s 님이 **%,d** 크레딧을 걸고 결투를 신청했습니다!\n수락하려면 아래 버튼을 누르세요. (%d분 후 만료)",
                mention(session.getChallengerId()), bet,
                Duration.between(session.getCreatedAt(), session.getExpiresAt()).toMinutes());
        String messageId = messagingPort.sendMessageWithActions(event.channelId(), text,
                List.of(MessageAction.danger(ActionIds.of(ActionIds.DUEL_ACCEPT, session.getId()), "결투 수락")));
        sessionRegistry.attachMessage(session.getId(), messageId);
    }

    @Override
    public void handle(String action, String payload, ChatActionEvent event) {
        DuelOutcome outcome = duelUseCase.accept(payload, event.actorId());
        String text = String.format("⚔️ 결투 종료!\n🏆 승자: %s (+%,d, 잔액 %,d)\n💀 패자: %s (-%,d, 잔액 %,d)",
                mention(outcome.winnerId()), outcome.payout() - outcome.bet(), outcome.winnerBalance(),
                mention(outcome.loserId()), outcome.bet(), outcome.loserBalance());
        messagingPort.editMessage(event.channelId(), event.sourceMessageId(), text, List.of());
    }
}
