package kr.socialcredit.economy.application.event;

import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.kafka.CreditAuditKafkaProducer;
import kr.socialcredit.economy.infrastructure.kafka.message.CreditAuditMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 크레딧 감사 리스너 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("크레딧 감사 리스너 단위 테스트")
class CreditAuditEventListenerTest {

    @Mock
    private ObjectProvider<CreditAuditKafkaProducer> kafkaProducerProvider;

    @Mock
    private CreditAuditKafkaProducer kafkaProducer;

    @Mock
    private MessagingPort messagingPort;

    private EconomyProperties properties;
    private CreditAuditEventListener listener;

    @BeforeEach
    void setUp() {
        properties = new EconomyProperties();
        lenient().doCallRealMethod().when(kafkaProducerProvider).ifAvailable(any());
        lenient().when(kafkaProducerProvider.getIfAvailable()).thenReturn(kafkaProducer);
        listener = new CreditAuditEventListener(kafkaProducerProvider, messagingPort, properties);
    }

    private CreditAdjustedEvent adjusted() {
        return CreditAdjustedEvent.of("user-1", 100L, 150L, 50L, "결투 승리", Instant.now());
    }

    @Test
    @DisplayName("잔액 변경은 Kafka로 발행된다")
    void adjusted_PublishesToKafka() {
        // when
        listener.onCreditAdjusted(adjusted());

        // then
        ArgumentCaptor<CreditAuditMessage> captor = ArgumentCaptor.forClass(CreditAuditMessage.class);
        verify(kafkaProducer).send(captor.capture());
        assertThat(captor.getValue().eventType()).isEqualTo("CREDIT_ADJUSTED");
        assertThat(captor.getValue().newBalance()).isEqualTo(150L);
        verify(messagingPort, never()).sendMessage(anyString(), anyString());
    }

    @Test
    @DisplayName("감사 채널이 설정되어 있으면 채널에도 알린다")
    void adjusted_NotifiesChannel() {
        properties.getAudit().setLogChannelId("audit-channel");

        listener.onCreditAdjusted(adjusted());

        verify(messagingPort).sendMessage(eq("audit-channel"), contains("결투 승리"));
    }

    @Test
    @DisplayName("Kafka 발행이나 채널 알림이 실패해도 예외를 던지지 않는다")
    void failuresAreIgnored() {
        properties.getAudit().setLogChannelId("audit-channel");
        doThrow(new IllegalStateException("broker down")).when(kafkaProducer).send(any());
        doThrow(new IllegalStateException("chat down")).when(messagingPort).sendMessage(anyString(), anyString());

        assertThatCode(() -> listener.onCreditAdjusted(adjusted())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("원장 갱신 실패는 오류 정보와 함께 발행된다")
    void writeFailed_Published() {
        listener.onLedgerWriteFailed(new LedgerWriteFailedEvent("user-1", -30L, "송금", "timeout", Instant.now()));

        ArgumentCaptor<CreditAuditMessage> captor = ArgumentCaptor.forClass(CreditAuditMessage.class);
        verify(kafkaProducer).send(captor.capture());
        assertThat(captor.getValue().eventType()).isEqualTo("LEDGER_WRITE_FAILED");
        assertThat(captor.getValue().error()).isEqualTo("timeout");
        assertThat(captor.getValue().oldBalance()).isNull();
    }
}
