package kr.socialcredit.economy.web.account;

import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.web.account.dto.AccountResponse;
import kr.socialcredit.economy.web.account.dto.LeaderboardEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 조회 전용 API. 잔액 변경은 채팅 명령으로만 가능하다.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private static final int MAX_LIMIT = 50;

    private final CreditLedgerUseCase creditLedger;

    /**
     * 크레딧 순위 (잔액 0 초과 사용자만)
     */
    @GetMapping("/top")
    public ResponseEntity<List<LeaderboardEntry>> top(@RequestParam(defaultValue = "5") int limit) {
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit 은 1 ~ " + MAX_LIMIT + " 사이여야 합니다");
        }
        List<Account> accounts = creditLedger.top(limit);
        List<LeaderboardEntry> entries = new ArrayList<>(accounts.size());
        for (int i = 0; i < accounts.size(); i++) {
            entries.add(new LeaderboardEntry(i + 1, accounts.get(i).getId(), accounts.get(i).getBalance()));
        }
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/{userId}")
    public ResponseEntity<AccountResponse> get(@PathVariable String userId) {
        return ResponseEntity.ok(AccountResponse.from(creditLedger.account(userId)));
    }
}
