package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.in.AdminUseCase;
import kr.socialcredit.economy.application.port.in.AdminUseCase.AdjustCommand;
import kr.socialcredit.economy.application.port.in.AdminUseCase.AdjustResult;
import kr.socialcredit.economy.application.port.in.AdminUseCase.MassCommand;
import kr.socialcredit.economy.application.port.in.AdminUseCase.MassOperation;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.chat.ChatArguments;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.chat.ChatCommandHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

import static kr.socialcredit.economy.chat.ChatArguments.mention;

/**
 * !admin @사용자 ±금액 [사유]
 * !adminmass <+|-|=>금액 @사용자... [사유]
 */
@Component
@RequiredArgsConstructor
public class AdminCommandHandler implements ChatCommandHandler {

    private final AdminUseCase adminUseCase;
    private final MessagingPort messagingPort;

    @Override
    public Set<String> commands() {
        return Set.of("admin", "adminmass");
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        if ("admin".equals(command)) {
            adjust(args, event);
        } else {
            mass(args, event);
        }
    }

    private void adjust(List<String> args, ChatCommandEvent event) {
        if (args.size() < 2) {
            throw new IllegalArgumentException("사용법: `!admin @사용자 ±금액 [사유]`");
        }
        String targetId = ChatArguments.userId(args.get(0));
        long delta = ChatArguments.signedAmount(args.get(1));
        String reason = ChatArguments.joinFrom(args, 2);

        AdjustResult result = adminUseCase.adjust(new AdjustCommand(event.authorId(), targetId, delta, reason));
        messagingPort.sendMessage(event.channelId(), String.format("🛠️ %s 잔액 조정: %,d → %,d (%+,d)%s",
                mention(targetId), result.previousBalance(), result.newBalance(), delta,
                reason.isBlank() ? "" : "\n사유: " + reason));
    }

    private void mass(List<String> args, ChatCommandEvent event) {
        if (args.size() < 2 || args.get(0).length() < 2) {
            throw new IllegalArgumentException("사용법: `!adminmass <+|-|=>금액 @사용자... [사유]`");
        }
        String opToken = args.get(0);
        MassOperation operation = MassOperation.fromSymbol(opToken.charAt(0));
        long amount = parseMassAmount(opToken.substring(1));
        List<String> rest = args.subList(1, args.size());
        List<String> targets = ChatArguments.leadingMentions(rest);
        String reason = ChatArguments.joinFrom(rest, targets.size());

        List<AdjustResult> results = adminUseCase.mass(
                new MassCommand(event.authorId(), operation, amount, targets, reason));

        StringBuilder sb = new StringBuilder(String.format("🛠️ 일괄 조정 (%c%,d) %d명\n",
                operation.getSymbol(), amount, results.size()));
        for (AdjustResult result : results) {
            sb.append(String.format("• %s: %,d → %,d\n", mention(result.targetId()),
                    result.previousBalance(), result.newBalance()));
        }
        if (!reason.isBlank()) {
            sb.append("사유: ").append(reason);
        }
        messagingPort.sendMessage(event.channelId(), sb.toString().trim());
    }

    private static long parseMassAmount(String raw) {
        try {
            long value = Long.parseLong(raw);
            if (value < 0) {
                throw new IllegalArgumentException("금액은 0 이상이어야 합니다: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("금액은 정수여야 합니다: " + raw);
        }
    }
}
