package kr.socialcredit.economy.domain.gacha;

/**
 * 보유 수량 부족
 */
public class InsufficientInventoryException extends RuntimeException {

    private final int held;

    public InsufficientInventoryException(String message, int held) {
        super(message);
        this.held = held;
    }

    public static InsufficientInventoryException of(String id, int requested, int held) {
        return new InsufficientInventoryException(
                String.format("보유 수량이 부족합니다: %s (요청: %d, 보유: %d)", id, requested, held),
                held
        );
    }

    public int getHeld() {
        return held;
    }
}
