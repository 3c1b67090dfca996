package kr.socialcredit.economy.domain.session;

/**
 * 세션 소유자가 아닌 사용자가 소유자 전용 동작을 시도한 경우
 */
public class NotSessionOwnerException extends RuntimeException {

    public NotSessionOwnerException(String sessionId, String actorId) {
        super("본인의 게임만 조작할 수 있습니다");
    }
}
