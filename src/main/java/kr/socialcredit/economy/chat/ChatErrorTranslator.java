package kr.socialcredit.economy.chat;

import kr.socialcredit.economy.application.port.out.TransientStoreException;
import kr.socialcredit.economy.domain.account.BalanceOverflowException;
import kr.socialcredit.economy.domain.account.InsufficientBalanceException;
import kr.socialcredit.economy.domain.account.LedgerWriteException;
import kr.socialcredit.economy.domain.common.exception.AdminOnlyException;
import kr.socialcredit.economy.domain.gacha.ContainerNotFoundException;
import kr.socialcredit.economy.domain.gacha.DailyLimitExceededException;
import kr.socialcredit.economy.domain.gacha.InsufficientInventoryException;
import kr.socialcredit.economy.domain.gacha.ItemNotFoundException;
import kr.socialcredit.economy.domain.gacha.OutOfStockException;
import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.NotSessionOwnerException;
import kr.socialcredit.economy.domain.session.SelfInteractionException;
import kr.socialcredit.economy.domain.session.SessionNotFoundException;
import kr.socialcredit.economy.infrastructure.lock.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 예외를 채팅 응답 문구로 변환
 */
@Slf4j
@Component
public class ChatErrorTranslator {

    public String translate(Exception e, String context) {
        if (e instanceof InsufficientBalanceException
                || e instanceof BalanceOverflowException
                || e instanceof SessionNotFoundException
                || e instanceof SelfInteractionException
                || e instanceof NotSessionOwnerException
                || e instanceof InvalidSessionStateException
                || e instanceof ItemNotFoundException
                || e instanceof ContainerNotFoundException
                || e instanceof InsufficientInventoryException
                || e instanceof OutOfStockException
                || e instanceof DailyLimitExceededException
                || e instanceof AdminOnlyException
                || e instanceof IllegalArgumentException
                || e instanceof LedgerWriteException) {
            log.debug("[채팅] 요청 거절: context={}, reason={}", context, e.getMessage());
            return "❌ " + e.getMessage();
        }
        if (e instanceof TransientStoreException) {
            log.warn("[채팅] 저장소 장애: context={}, error={}", context, e.getMessage());
            return "❌ 저장소 연결이 불안정합니다. 잠시 후 다시 시도하세요";
        }
        if (e instanceof LockAcquisitionException) {
            log.warn("[채팅] 락 획득 실패: context={}", context);
            return "❌ 요청이 몰리고 있습니다. 잠시 후 다시 시도하세요";
        }
        log.error("[채팅] 처리 중 예상치 못한 오류: context={}", context, e);
        return "❌ 처리 중 오류가 발생했습니다";
    }
}
