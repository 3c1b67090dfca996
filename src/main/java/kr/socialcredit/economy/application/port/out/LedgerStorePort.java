package kr.socialcredit.economy.application.port.out;

import kr.socialcredit.economy.domain.account.Account;

import java.util.List;
import java.util.Optional;

/**
 * 계정 원장 저장소 포트
 * - 순수 데이터 접근만 담당
 * - 잔액 규칙은 CreditLedgerService에서 처리
 */
public interface LedgerStorePort {

    // 조회
    Optional<Account> findById(String userId);
    List<Account> findAll();

    // 저장
    void save(Account account);
}
