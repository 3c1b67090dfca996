package kr.socialcredit.economy.infrastructure.lock;

/**
 * 경제 상태 락 획득 실패 시 발생하는 예외
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LockAcquisitionException of(String purpose, int maxRetries) {
        return new LockAcquisitionException(
                String.format("락 획득 실패: purpose = %s, 최대 재시도 횟수 %d 초과", purpose, maxRetries)
        );
    }
}
