package kr.socialcredit.economy.application.event;

import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.kafka.CreditAuditKafkaProducer;
import kr.socialcredit.economy.infrastructure.kafka.message.CreditAuditMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 크레딧 감사 로그 싱크
 * - 로그 기록
 * - Kafka 발행 (economy.audit.kafka-enabled)
 * - 감사 채널 알림 (economy.audit.log-channel-id)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreditAuditEventListener {

    private final ObjectProvider<CreditAuditKafkaProducer> kafkaProducer;
    private final MessagingPort messagingPort;
    private final EconomyProperties properties;

    @Async
    @EventListener
    public void onCreditAdjusted(CreditAdjustedEvent event) {
        log.info("[감사] 잔액 변경 - userId: {}, {} → {} ({}{}), reason: {}",
                event.userId(), event.oldBalance(), event.newBalance(),
                event.delta() > 0 ? "+" : "", event.delta(), event.reason());
        publish(CreditAuditMessage.adjusted(event));
        notifyChannel(String.format("📒 <@%s> %,d → %,d (%+,d) | %s",
                event.userId(), event.oldBalance(), event.newBalance(), event.delta(), event.reason()));
    }

    @Async
    @EventListener
    public void onLedgerWriteFailed(LedgerWriteFailedEvent event) {
        log.error("[감사] 원장 갱신 실패 - userId: {}, delta: {}, reason: {}, error: {}",
                event.userId(), event.delta(), event.reason(), event.error());
        publish(CreditAuditMessage.writeFailed(event));
        notifyChannel(String.format("🚨 원장 갱신 실패: <@%s> %+,d | %s | %s",
                event.userId(), event.delta(), event.reason(), event.error()));
    }

    private void publish(CreditAuditMessage message) {
        try {
            kafkaProducer.ifAvailable(producer -> producer.send(message));
        } catch (Exception e) {
            log.warn("⚠️ [감사] Kafka 발행 실패 (무시) - userId: {}, error: {}", message.userId(), e.getMessage());
        }
    }

    private void notifyChannel(String text) {
        String channelId = properties.getAudit().getLogChannelId();
        if (channelId == null || channelId.isBlank()) {
            return;
        }
        try {
            messagingPort.sendMessage(channelId, text);
        } catch (Exception e) {
            log.warn("⚠️ [감사] 채널 알림 실패 (무시) - channelId: {}, error: {}", channelId, e.getMessage());
        }
    }
}
