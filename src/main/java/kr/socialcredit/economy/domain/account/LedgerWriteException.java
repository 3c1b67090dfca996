package kr.socialcredit.economy.domain.account;

/**
 * 재시도 후에도 원장 갱신에 실패한 경우
 * 호출자 입장에서 해당 변경은 일어나지 않은 것으로 본다.
 */
public class LedgerWriteException extends RuntimeException {

    private final String userId;
    private final long delta;

    public LedgerWriteException(String userId, long delta, Throwable cause) {
        super("크레딧 원장을 갱신하지 못했습니다. 잠시 후 다시 시도하세요", cause);
        this.userId = userId;
        this.delta = delta;
    }

    public String getUserId() {
        return userId;
    }

    public long getDelta() {
        return delta;
    }
}
