package kr.socialcredit.economy.application.port.in;

import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.domain.account.GameType;

import java.util.List;

public interface CreditLedgerUseCase {

    record TransferCommand(String fromUserId, String toUserId, long amount, String reason) {}

    record TransferResult(String fromUserId, String toUserId, long amount,
                          long fromBalance, long toBalance) {}

    /**
     * 잔액 조회. 기록이 없거나 저장소 장애가 재시도 후에도 계속되면 0을 반환한다.
     */
    long getBalance(String userId);

    /**
     * 잔액 변경. 결과가 음수가 되면 0으로 고정된다.
     *
     * @return 변경 후 잔액
     */
    long adjust(String userId, long delta, String reason);

    /**
     * 잔액이 amount 이상일 때만 차감 (베팅, 구매)
     *
     * @return 차감 후 잔액
     */
    long withdraw(String userId, long amount, String reason);

    TransferResult transfer(TransferCommand command);

    void recordGame(String userId, GameType gameType, boolean won);

    /**
     * 음성 채널 체류 시간과 보상 크레딧을 한 번의 쓰기로 반영
     *
     * @return 반영 후 잔액
     */
    long recordVoiceActivity(String userId, long seconds, long credits, String reason);

    /**
     * 계정 조회 (없으면 잔액 0의 새 계정)
     */
    Account account(String userId);

    /**
     * 잔액 상위 계정 (잔액 0 제외)
     */
    List<Account> top(int limit);
}
