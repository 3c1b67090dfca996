package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.event.SessionExpiredEvent;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 만료된 세션의 메시지를 타임아웃 안내로 바꾸고 버튼을 제거
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionExpiryNotifier {

    private final MessagingPort messagingPort;

    @EventListener
    public void onSessionExpired(SessionExpiredEvent event) {
        if (event.messageId() == null) {
            return;
        }
        String text = event.refunds().isEmpty()
                ? String.format("⌛ %s 시간이 초과되어 종료되었습니다", event.kind().getDisplayName())
                : String.format("⌛ %s 시간이 초과되어 종료되었습니다. 베팅 %,d 크레딧 환불",
                        event.kind().getDisplayName(),
                        event.refunds().values().stream().mapToLong(Long::longValue).sum());
        try {
            messagingPort.editMessage(event.channelId(), event.messageId(), text, List.of());
        } catch (Exception e) {
            log.warn("⚠️ 만료 안내 메시지 수정 실패 (무시): session={}, error={}", event.sessionId(), e.getMessage());
        }
    }
}
