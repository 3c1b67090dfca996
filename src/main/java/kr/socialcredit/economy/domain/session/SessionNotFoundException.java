package kr.socialcredit.economy.domain.session;

/**
 * 세션이 없거나 이미 처리된 경우
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("이미 처리되었거나 존재하지 않는 게임입니다");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
