package kr.socialcredit.economy.domain.session;

/**
 * 현재 상태에서 허용되지 않는 세션 동작
 */
public class InvalidSessionStateException extends RuntimeException {

    private final String sessionId;

    public InvalidSessionStateException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
