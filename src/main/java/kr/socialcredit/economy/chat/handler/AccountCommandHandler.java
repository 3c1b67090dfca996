package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase.TransferCommand;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase.TransferResult;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.chat.ChatArguments;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.chat.ChatCommandHandler;
import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.domain.account.GameStats;
import kr.socialcredit.economy.domain.account.GameType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

import static kr.socialcredit.economy.chat.ChatArguments.mention;

/**
 * !balance, !transfer, !top, !stats
 */
@Component
@RequiredArgsConstructor
public class AccountCommandHandler implements ChatCommandHandler {

    private static final int LEADERBOARD_SIZE = 5;
    private static final String[] MEDALS = {"🥇", "🥈", "🥉", "4.", "5."};

    private final CreditLedgerUseCase creditLedger;
    private final MessagingPort messagingPort;

    @Override
    public Set<String> commands() {
        return Set.of("balance", "transfer", "top", "stats");
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        switch (command) {
            case "balance" -> balance(args, event);
            case "transfer" -> transfer(args, event);
            case "top" -> top(event);
            case "stats" -> stats(args, event);
            default -> throw new IllegalArgumentException("지원하지 않는 명령입니다: " + command);
        }
    }

    private void balance(List<String> args, ChatCommandEvent event) {
        String userId = args.isEmpty() ? event.authorId() : ChatArguments.userId(args.get(0));
        long balance = creditLedger.getBalance(userId);
        messagingPort.sendMessage(event.channelId(),
                String.format("💰 %s 의 잔액: **%,d** 크레딧", mention(userId), balance));
    }

    private void transfer(List<String> args, ChatCommandEvent event) {
        if (args.size() < 2) {
            throw new IllegalArgumentException("사용법: `!transfer @사용자 금액 [사유]`");
        }
        String targetId = ChatArguments.userId(args.get(0));
        long amount = ChatArguments.amount(args.get(1));
        String reason = ChatArguments.joinFrom(args, 2);

        TransferResult result = creditLedger.transfer(new TransferCommand(
                event.authorId(), targetId, amount, reason.isBlank() ? "송금" : reason));
        messagingPort.sendMessage(event.channelId(), String.format(
                "✅ %s → %s **%,d** 크레딧 송금 완료\n보낸 사람 잔액: %,d | 받은 사람 잔액: %,d",
                mention(result.fromUserId()), mention(result.toUserId()), result.amount(),
                result.fromBalance(), result.toBalance()));
    }

    private void top(ChatCommandEvent event) {
        List<Account> top = creditLedger.top(LEADERBOARD_SIZE);
        if (top.isEmpty()) {
            messagingPort.sendMessage(event.channelId(), "🏆 아직 크레딧을 가진 사용자가 없습니다");
            return;
        }
        StringBuilder sb = new StringBuilder("🏆 **크레딧 순위**\n");
        for (int i = 0; i < top.size(); i++) {
            Account account = top.get(i);
            sb.append(MEDALS[i]).append(' ')
                    .append(mention(account.getId()))
                    .append(String.format(": %,d 크레딧", account.getBalance()))
                    .append('\n');
        }
        messagingPort.sendMessage(event.channelId(), sb.toString().trim());
    }

    private void stats(List<String> args, ChatCommandEvent event) {
        String userId = args.isEmpty() ? event.authorId() : ChatArguments.userId(args.get(0));
        Account account = creditLedger.account(userId);
        StringBuilder sb = new StringBuilder(String.format("📊 %s 의 전적 (잔액 %,d)\n", mention(userId), account.getBalance()));
        for (GameType type : GameType.values()) {
            GameStats stats = account.statsOf(type);
            sb.append(String.format("• %s: %d전 %d승 %d패\n", type.getDisplayName(), stats.played(), stats.won(), stats.lost()));
        }
        sb.append("• 음성 채널: ").append(formatVoiceTime(account.getVoiceSeconds()));
        messagingPort.sendMessage(event.channelId(), sb.toString().trim());
    }

    static String formatVoiceTime(long seconds) {
        long hours = seconds / 3600;
        long minutes = seconds % 3600 / 60;
        return hours > 0
                ? String.format("%d시간 %d분", hours, minutes)
                : String.format("%d분 %d초", minutes, seconds % 60);
    }
}
