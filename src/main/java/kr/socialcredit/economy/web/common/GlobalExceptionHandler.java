package kr.socialcredit.economy.web.common;

import kr.socialcredit.economy.application.port.out.TransientStoreException;
import kr.socialcredit.economy.domain.account.LedgerWriteException;
import kr.socialcredit.economy.domain.gacha.ContainerNotFoundException;
import kr.socialcredit.economy.domain.gacha.ItemNotFoundException;
import kr.socialcredit.economy.infrastructure.lock.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    record ErrorResponse(String code, String message) {}

    // ========== 카탈로그 ==========
    @ExceptionHandler(ItemNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleItemNotFound(ItemNotFoundException e) {
        return new ErrorResponse("ITEM_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ContainerNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleContainerNotFound(ContainerNotFoundException e) {
        return new ErrorResponse("CONTAINER_NOT_FOUND", e.getMessage());
    }

    // ========== 저장소 / 락 ==========
    @ExceptionHandler({TransientStoreException.class, LedgerWriteException.class})
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    ErrorResponse handleStoreUnavailable(RuntimeException e) {
        log.warn("[API] 저장소 오류: {}", e.getMessage());
        return new ErrorResponse("STORE_UNAVAILABLE", "저장소에 일시적으로 접근할 수 없습니다");
    }

    @ExceptionHandler(LockAcquisitionException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    ErrorResponse handleLockAcquisition(LockAcquisitionException e) {
        return new ErrorResponse("BUSY", e.getMessage());
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalState(IllegalStateException e) {
        return new ErrorResponse("INVALID_STATE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) {
        return new ErrorResponse("INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    ErrorResponse handleGenericException(Exception e) {
        log.error("[API] 처리되지 않은 오류", e);
        return new ErrorResponse("INTERNAL_ERROR", "서버 내부 오류가 발생했습니다");
    }
}
