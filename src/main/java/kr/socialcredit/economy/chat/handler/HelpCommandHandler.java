package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.chat.ChatCommandHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class HelpCommandHandler implements ChatCommandHandler {

    private static final String HELP = """
            📖 **명령어**
            `!balance [@사용자]` 잔액 확인
            `!transfer @사용자 금액 [사유]` 송금
            `!top` 크레딧 순위 | `!stats [@사용자]` 전적
            `!duel 금액` 결투 신청
            `!rb` 레드블랙 시작 → `!rb red|black 금액` 베팅
            `!blackjack` 블랙잭 시작 → `!blackjack 금액` 베팅
            `!cases` 케이스 목록 | `!buycase ID` 구매 | `!opencase ID` 개봉
            `!inventory` 보유 아이템 | `!sell 아이템ID 수량` 판매 | `!prices` 시세
            음성 채널에 머물면 1분마다 1크레딧
            관리자: `!admin`, `!adminmass`, `!endblackjack @사용자`""";

    private final MessagingPort messagingPort;

    @Override
    public Set<String> commands() {
        return Set.of("help");
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        messagingPort.sendMessage(event.channelId(), HELP);
    }
}
