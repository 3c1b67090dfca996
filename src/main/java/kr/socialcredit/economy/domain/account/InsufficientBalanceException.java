package kr.socialcredit.economy.domain.account;

/**
 * 크레딧 잔액 부족 예외
 */
public class InsufficientBalanceException extends RuntimeException {

    private final long balance;

    public InsufficientBalanceException(String message, long balance) {
        super(message);
        this.balance = balance;
    }

    // 편의 팩토리 메서드
    public static InsufficientBalanceException of(long requestedAmount, long currentBalance) {
        return new InsufficientBalanceException(
                String.format("크레딧이 부족합니다. 요청: %,d, 현재 잔액: %,d",
                        requestedAmount, currentBalance),
                currentBalance
        );
    }

    public long getBalance() {
        return balance;
    }
}
