package kr.socialcredit.economy.domain.session;

/**
 * 자기 자신과의 상호작용 시도 (자기 결투 수락, 자기 송금 등)
 */
public class SelfInteractionException extends RuntimeException {

    public SelfInteractionException(String message) {
        super(message);
    }
}
