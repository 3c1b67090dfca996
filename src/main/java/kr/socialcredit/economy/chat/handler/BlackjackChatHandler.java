package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.in.BlackjackUseCase;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.application.service.SessionRegistry;
import kr.socialcredit.economy.chat.ActionIds;
import kr.socialcredit.economy.chat.ChatActionEvent;
import kr.socialcredit.economy.chat.ChatActionHandler;
import kr.socialcredit.economy.chat.ChatArguments;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.chat.ChatCommandHandler;
import kr.socialcredit.economy.domain.blackjack.BlackjackSession;
import kr.socialcredit.economy.domain.blackjack.BlackjackState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static kr.socialcredit.economy.chat.ChatArguments.mention;

/**
 * !blackjack [금액], !endblackjack @사용자, [Hit]/[Stand]/[다시하기] 버튼
 */
@Component
@RequiredArgsConstructor
public class BlackjackChatHandler implements ChatCommandHandler, ChatActionHandler {

    private final BlackjackUseCase blackjackUseCase;
    private final CreditLedgerUseCase creditLedger;
    private final SessionRegistry sessionRegistry;
    private final MessagingPort messagingPort;

    @Override
    public Set<String> commands() {
        return Set.of("blackjack", "endblackjack");
    }

    @Override
    public Set<String> actions() {
        return Set.of(ActionIds.BJ_HIT, ActionIds.BJ_STAND, ActionIds.BJ_REPLAY);
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        if ("endblackjack".equals(command)) {
            forceEnd(args, event);
            return;
        }
        if (args.isEmpty()) {
            showMenu(blackjackUseCase.start(event.authorId(), event.channelId()));
            return;
        }
        long amount = ChatArguments.amount(args.get(0));
        BlackjackSession session = blackjackUseCase.bet(event.authorId(), amount);
        render(session, event.channelId(), session.getMessageId());
    }

    @Override
    public void handle(String action, String payload, ChatActionEvent event) {
        switch (action) {
            case ActionIds.BJ_HIT -> render(blackjackUseCase.hit(payload, event.actorId()),
                    event.channelId(), event.sourceMessageId());
            case ActionIds.BJ_STAND -> render(blackjackUseCase.stand(payload, event.actorId()),
                    event.channelId(), event.sourceMessageId());
            case ActionIds.BJ_REPLAY -> showMenu(blackjackUseCase.replay(event.actorId(), payload, event.channelId()));
            default -> throw new IllegalArgumentException("지원하지 않는 동작입니다: " + action);
        }
    }

    private void forceEnd(List<String> args, ChatCommandEvent event) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("사용법: `!endblackjack @사용자`");
        }
        String targetId = ChatArguments.userId(args.get(0));
        Optional<BlackjackSession> ended = blackjackUseCase.forceEnd(event.authorId(), targetId);
        if (ended.isEmpty()) {
            messagingPort.sendMessage(event.channelId(), mention(targetId) + " 님은 진행 중인 블랙잭 게임이 없습니다");
            return;
        }
        BlackjackSession session = ended.get();
        String text = session.getBet() > 0
                ? String.format("🛑 %s 님의 블랙잭 게임이 관리자에 의해 종료되었습니다. 베팅 %,d 크레딧 환불", mention(targetId), session.getBet())
                : String.format("🛑 %s 님의 블랙잭 게임이 관리자에 의해 종료되었습니다", mention(targetId));
        if (session.getMessageId() != null) {
            messagingPort.editMessage(session.getChannelId(), session.getMessageId(), text, List.of());
        }
        messagingPort.sendMessage(event.channelId(), text);
    }

    private void showMenu(BlackjackSession session) {
        String text = String.format("🃏 **블랙잭** %s\n💰 잔액: %,d 크레딧\n`!blackjack 금액` 으로 베팅하세요",
                mention(session.getOwnerId()), creditLedger.getBalance(session.getOwnerId()));
        String messageId = messagingPort.sendMessageWithActions(session.getChannelId(), text, List.of());
        sessionRegistry.attachMessage(session.getId(), messageId);
    }

    private void render(BlackjackSession session, String channelId, String messageId) {
        String text = describe(session);
        List<MessageAction> actions = session.getState() == BlackjackState.PLAYER_TURN
                ? List.of(MessageAction.success(ActionIds.of(ActionIds.BJ_HIT, session.getId()), "Hit"),
                          MessageAction.danger(ActionIds.of(ActionIds.BJ_STAND, session.getId()), "Stand"))
                : List.of(MessageAction.primary(ActionIds.of(ActionIds.BJ_REPLAY, session.getOwnerId()), "다시하기"));

        if (messageId == null) {
            String sent = messagingPort.sendMessageWithActions(channelId, text, actions);
            if (session.isActive()) {
                sessionRegistry.attachMessage(session.getId(), sent);
            }
            return;
        }
        messagingPort.editMessage(channelId, messageId, text, actions);
    }

    private String describe(BlackjackSession session) {
        StringBuilder sb = new StringBuilder(String.format("🃏 **블랙잭** %s (베팅 %,d)\n",
                mention(session.getOwnerId()), session.getBet()));
        sb.append(String.format("내 패: %s (%d)\n", session.getPlayerHand(), session.getPlayerHand().total()));

        if (session.getState() == BlackjackState.PLAYER_TURN) {
            sb.append(String.format("딜러 패: %s ❓", session.getDealerHand().first()));
            return sb.toString();
        }
        sb.append(String.format("딜러 패: %s (%d)\n", session.getDealerHand(), session.getDealerHand().total()));
        long payout = session.payout();
        String result = session.getOutcome().isPlayerWon()
                ? String.format("✅ %s! **%,d** 크레딧 획득", session.getOutcome().getDisplayName(), payout)
                : payout > 0
                ? String.format("🤝 %s, 베팅 %,d 크레딧 반환", session.getOutcome().getDisplayName(), payout)
                : String.format("❌ %s... %,d 크레딧을 잃었습니다", session.getOutcome().getDisplayName(), session.getBet());
        sb.append(result);
        return sb.toString();
    }
}
