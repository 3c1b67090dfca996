package kr.socialcredit.economy.application.port.out;

/**
 * 외부 저장소 일시 장애 (네트워크 단절, 타임아웃 등)
 * 재시도 대상이다.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
