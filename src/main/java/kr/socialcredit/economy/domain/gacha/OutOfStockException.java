package kr.socialcredit.economy.domain.gacha;

/**
 * 은행 재고 소진
 */
public class OutOfStockException extends RuntimeException {

    public OutOfStockException(String containerId) {
        super("은행에 남은 케이스가 없습니다: " + containerId);
    }
}
