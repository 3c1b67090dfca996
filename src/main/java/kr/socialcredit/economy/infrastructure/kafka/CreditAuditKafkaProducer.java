package kr.socialcredit.economy.infrastructure.kafka;

import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.kafka.message.CreditAuditMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "economy.audit.kafka-enabled", havingValue = "true")
public class CreditAuditKafkaProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final EconomyProperties properties;

    /**
     * 감사 메시지 발행 (key: userId)
     */
    public void send(CreditAuditMessage message) {
        String topic = properties.getAudit().getTopic();
        String key = message.userId();

        kafkaTemplate.send(topic, key, message)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.debug("[Kafka] 감사 메시지 발행 성공 - topic: {}, key: {}, partition: {}",
                                topic, key, result.getRecordMetadata().partition());
                    } else {
                        log.error("[Kafka] 감사 메시지 발행 실패 - topic: {}, key: {}", topic, key, ex);
                    }
                });
    }
}
