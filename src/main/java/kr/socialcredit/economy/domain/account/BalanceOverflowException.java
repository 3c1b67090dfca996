package kr.socialcredit.economy.domain.account;

/**
 * 잔액이 표현 가능한 최대값을 넘는 변경 예외
 */
public class BalanceOverflowException extends RuntimeException {

    public BalanceOverflowException(long balance, long delta) {
        super(String.format("잔액 한도를 넘습니다. 현재 잔액: %,d, 변경: %,d", balance, delta));
    }
}
