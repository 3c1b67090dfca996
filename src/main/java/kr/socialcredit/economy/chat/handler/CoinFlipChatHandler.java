package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.in.CoinFlipUseCase;
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
import kr.socialcredit.economy.domain.casino.CoinFlipResult;
import kr.socialcredit.economy.domain.casino.CoinFlipSession;
import kr.socialcredit.economy.domain.casino.CoinSide;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static kr.socialcredit.economy.chat.ChatArguments.mention;

/**
 * !rb / !rb red|black 금액 / [다시하기] 버튼
 *
 * 정산은 베팅 시점에 끝나고, 결과 연출은 TaskScheduler에 예약된 메시지 수정으로만 보여준다.
 * 연출 중에는 경제 락을 잡지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoinFlipChatHandler implements ChatCommandHandler, ChatActionHandler {

    private static final String[] SPIN_FRAMES = {"🔴 ⚫ 🔴", "⚫ 🔴 ⚫", "🔴 🔴 ⚫", "⚫ ⚫ 🔴"};

    private final CoinFlipUseCase coinFlipUseCase;
    private final CreditLedgerUseCase creditLedger;
    private final SessionRegistry sessionRegistry;
    private final MessagingPort messagingPort;
    private final TaskScheduler taskScheduler;
    private final EconomyProperties properties;
    private final Clock clock;

    @Override
    public Set<String> commands() {
        return Set.of("rb");
    }

    @Override
    public Set<String> actions() {
        return Set.of(ActionIds.RB_REPLAY);
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        if (args.isEmpty()) {
            showMenu(coinFlipUseCase.start(event.authorId(), event.channelId()));
            return;
        }
        if (args.size() != 2) {
            throw new IllegalArgumentException("사용법: `!rb red|black 금액`");
        }
        CoinSide side = CoinSide.parse(args.get(0));
        long amount = ChatArguments.amount(args.get(1));

        CoinFlipResult result = coinFlipUseCase.placeBet(event.authorId(), side, amount);
        String messageId = messagingPort.sendMessageWithActions(event.channelId(),
                String.format("🎰 %s 님이 %s %s 에 **%,d** 크레딧을 걸었습니다! 룰렛이 돌아갑니다...",
                        mention(result.playerId()), side.getSymbol(), side.getDisplayName(), amount),
                List.of());
        animate(event.channelId(), messageId, result);
    }

    @Override
    public void handle(String action, String payload, ChatActionEvent event) {
        CoinFlipSession session = coinFlipUseCase.replay(event.actorId(), payload, event.channelId());
        showMenu(session);
    }

    private void showMenu(CoinFlipSession session) {
        String text = String.format("🎰 **레드블랙** %s\n💰 잔액: %,d 크레딧\n`!rb red 금액` 또는 `!rb black 금액` 으로 베팅하세요",
                mention(session.getOwnerId()), creditLedger.getBalance(session.getOwnerId()));
        String messageId = messagingPort.sendMessageWithActions(session.getChannelId(), text, List.of());
        sessionRegistry.attachMessage(session.getId(), messageId);
    }

    private void animate(String channelId, String messageId, CoinFlipResult result) {
        int frames = properties.getCasino().getRevealFrames();
        Duration delay = properties.getCasino().getRevealDelay();
        Instant start = clock.instant();

        for (int i = 1; i < frames; i++) {
            String frame = "🎰 " + SPIN_FRAMES[(i - 1) % SPIN_FRAMES.length];
            taskScheduler.schedule(() -> edit(channelId, messageId, frame, List.of()),
                    start.plus(delay.multipliedBy(i)));
        }
        taskScheduler.schedule(() -> edit(channelId, messageId, resultText(result),
                        List.of(MessageAction.primary(ActionIds.of(ActionIds.RB_REPLAY, result.playerId()), "다시하기"))),
                start.plus(delay.multipliedBy(Math.max(frames, 1))));
    }

    private String resultText(CoinFlipResult result) {
        String header = String.format("🎰 결과: %s %s\n", result.outcome().getSymbol(), result.outcome().getDisplayName());
        if (result.won()) {
            return header + String.format("✅ %s 승리! **%,d** 크레딧 획득 (잔액 %,d)",
                    mention(result.playerId()), result.payout(), result.balanceAfter());
        }
        return header + String.format("❌ %s 패배... %,d 크레딧을 잃었습니다 (잔액 %,d)",
                mention(result.playerId()), result.bet(), result.balanceAfter());
    }

    private void edit(String channelId, String messageId, String text, List<MessageAction> actions) {
        try {
            messagingPort.editMessage(channelId, messageId, text, actions);
        } catch (Exception e) {
            log.warn("[레드블랙] 연출 메시지 수정 실패: message={}, error={}", messageId, e.getMessage());
        }
    }
}
