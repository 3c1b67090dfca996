package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.event.CreditAdjustedEvent;
import kr.socialcredit.economy.application.event.LedgerWriteFailedEvent;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.out.LedgerStorePort;
import kr.socialcredit.economy.application.port.out.TransientStoreException;
import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.domain.account.BalanceOverflowException;
import kr.socialcredit.economy.domain.account.GameType;
import kr.socialcredit.economy.domain.account.InsufficientBalanceException;
import kr.socialcredit.economy.domain.account.LedgerWriteException;
import kr.socialcredit.economy.domain.session.SelfInteractionException;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * 크레딧 원장 서비스
 * - 잔액 0 미만 불가: 음수 delta는 거절하지 않고 0에서 멈춤
 * - 읽기: 저장소 장애 시 0 반환 (fail-open)
 * - 쓰기: 재시도 소진 시 LedgerWriteException + 운영자 알림 이벤트
 *
 * [락 적용]
 * - 모든 읽기-수정-쓰기는 EconomyStateLock 안에서 수행
 * - 락은 재진입 가능하므로 게임 서비스의 정산 구간 안에서 호출해도 된다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerService implements CreditLedgerUseCase {

    private final LedgerStorePort ledgerStore;
    private final EconomyStateLock stateLock;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public long getBalance(String userId) {
        try {
            return ledgerStore.findById(userId)
                    .map(Account::getBalance)
                    .orElse(0L);
        } catch (TransientStoreException e) {
            log.error("잔액 조회 실패, 0으로 처리: userId={}, error={}", userId, e.getMessage());
            return 0L;
        }
    }

    @Override
    public long adjust(String userId, long delta, String reason) {
        requireUserId(userId);
        return stateLock.executeWithLock("adjust:" + userId,
                () -> applyDelta(userId, delta, reason));
    }

    @Override
    public long withdraw(String userId, long amount, String reason) {
        requirePositive(amount);
        return stateLock.executeWithLock("withdraw:" + userId, () -> {
            long current = loadForUpdate(userId, -amount, reason).getBalance();
            if (current < amount) {
                throw InsufficientBalanceException.of(amount, current);
            }
            return applyDelta(userId, -amount, reason);
        });
    }

    /**
     * 송금: 출금 후 입금
     * 입금이 실패하면 출금을 되돌린다. 되돌리기마저 실패하면 유실 금액을 운영자 알림으로 남긴다.
     */
    @Override
    public TransferResult transfer(TransferCommand command) {
        requireUserId(command.fromUserId());
        requireUserId(command.toUserId());
        requirePositive(command.amount());
        if (command.fromUserId().equals(command.toUserId())) {
            throw new SelfInteractionException("자기 자신에게는 송금할 수 없습니다");
        }

        return stateLock.executeWithLock("transfer:" + command.fromUserId(), () -> {
            long fromBalance = withdraw(command.fromUserId(), command.amount(),
                    "송금 출금 → " + command.toUserId() + ": " + command.reason());
            long toBalance;
            try {
                toBalance = applyDelta(command.toUserId(), command.amount(),
                        "송금 입금 ← " + command.fromUserId() + ": " + command.reason());
            } catch (LedgerWriteException | BalanceOverflowException e) {
                log.error("송금 입금 실패, 출금 보상 진행: from={}, to={}, amount={}",
                        command.fromUserId(), command.toUserId(), command.amount());
                compensate(command, e);
                throw e;
            }
            log.info("송금 완료: from={}, to={}, amount={}",
                    command.fromUserId(), command.toUserId(), command.amount());
            return new TransferResult(command.fromUserId(), command.toUserId(), command.amount(),
                    fromBalance, toBalance);
        });
    }

    @Override
    public void recordGame(String userId, GameType gameType, boolean won) {
        stateLock.runWithLock("stats:" + userId, () -> {
            try {
                Account account = ledgerStore.findById(userId).orElseGet(() -> Account.open(userId));
                account.recordGame(gameType, won);
                ledgerStore.save(account);
            } catch (TransientStoreException e) {
                // 전적은 정산 결과에 영향을 주지 않으므로 기록만 남긴다
                log.warn("전적 기록 실패: userId={}, game={}, won={}, error={}",
                        userId, gameType, won, e.getMessage());
            }
        });
    }

    @Override
    public long recordVoiceActivity(String userId, long seconds, long credits, String reason) {
        requireUserId(userId);
        if (seconds < 0 || credits < 0) {
            throw new IllegalArgumentException("음성 시간과 보상은 0 이상이어야 합니다");
        }
        return stateLock.executeWithLock("voice:" + userId, () -> {
            Account account = loadForUpdate(userId, credits, reason);
            long oldBalance = account.getBalance();
            account.addVoiceSeconds(seconds);
            long newBalance = account.applyDelta(credits);

            try {
                ledgerStore.save(account);
            } catch (TransientStoreException e) {
                throw writeFailed(userId, credits, reason, e);
            }

            if (credits > 0) {
                log.debug("음성 보상: userId={}, seconds={}, {} → {}", userId, seconds, oldBalance, newBalance);
                eventPublisher.publishEvent(CreditAdjustedEvent.of(
                        userId, oldBalance, newBalance, credits, reason, clock.instant()));
            }
            return newBalance;
        });
    }

    @Override
    public Account account(String userId) {
        try {
            return ledgerStore.findById(userId).orElseGet(() -> Account.open(userId));
        } catch (TransientStoreException e) {
            log.error("계정 조회 실패, 빈 계정으로 처리: userId={}, error={}", userId, e.getMessage());
            return Account.open(userId);
        }
    }

    @Override
    public List<Account> top(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("조회 개수는 0보다 커야 합니다");
        }
        return ledgerStore.findAll().stream()
                .filter(account -> account.getBalance() > 0)
                .sorted(Comparator.comparingLong(Account::getBalance).reversed()
                        .thenComparing(Account::getId))
                .limit(limit)
                .toList();
    }

    private long applyDelta(String userId, long delta, String reason) {
        Account account = loadForUpdate(userId, delta, reason);
        long oldBalance = account.getBalance();
        if (delta == 0) {
            return oldBalance;
        }
        long newBalance = account.applyDelta(delta);

        try {
            ledgerStore.save(account);
        } catch (TransientStoreException e) {
            throw writeFailed(userId, delta, reason, e);
        }

        log.debug("잔액 변경: userId={}, {} → {} (delta={}, reason={})",
                userId, oldBalance, newBalance, delta, reason);
        eventPublisher.publishEvent(CreditAdjustedEvent.of(
                userId, oldBalance, newBalance, delta, reason, clock.instant()));
        return newBalance;
    }

    private Account loadForUpdate(String userId, long delta, String reason) {
        try {
            return ledgerStore.findById(userId).orElseGet(() -> Account.open(userId));
        } catch (TransientStoreException e) {
            throw writeFailed(userId, delta, reason, e);
        }
    }

    private LedgerWriteException writeFailed(String userId, long delta, String reason, TransientStoreException e) {
        log.error("[운영자 확인 필요] 원장 갱신 실패: userId={}, delta={}, reason={}", userId, delta, reason, e);
        eventPublisher.publishEvent(new LedgerWriteFailedEvent(
                userId, delta, reason, e.getMessage(), clock.instant()));
        return new LedgerWriteException(userId, delta, e);
    }

    private void compensate(TransferCommand command, RuntimeException cause) {
        try {
            applyDelta(command.fromUserId(), command.amount(), "송금 실패 보상: " + command.reason());
        } catch (LedgerWriteException compensationFailure) {
            log.error("[운영자 확인 필요] 송금 보상 실패, {} 크레딧 유실: from={}, to={}",
                    command.amount(), command.fromUserId(), command.toUserId());
            cause.addSuppressed(compensationFailure);
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("사용자 ID는 비어있을 수 없습니다");
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("금액은 0보다 커야 합니다");
        }
    }
}
