package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.in.DuelUseCase;
import kr.socialcredit.economy.domain.account.GameType;
import kr.socialcredit.economy.domain.account.InsufficientBalanceException;
import kr.socialcredit.economy.domain.common.GameRandom;
import kr.socialcredit.economy.domain.duel.DuelOutcome;
import kr.socialcredit.economy.domain.duel.DuelSession;
import kr.socialcredit.economy.domain.session.SelfInteractionException;
import kr.socialcredit.economy.domain.session.SessionId;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 결투 서비스
 *
 * [실행 순서]
 * - 생성: 락 획득 → 도전자 잔액 확인/차감 → 세션 등록
 * - 수락: 락 획득 → 상대 잔액 확인 → 세션 수락(상태 변경) → 상대 차감 → 50/50 추첨 → 승자에게 2배 지급 → 전적 기록 → 세션 제거
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuelService implements DuelUseCase {

    private final SessionRegistry sessionRegistry;
    private final CreditLedgerUseCase creditLedger;
    private final EconomyStateLock stateLock;
    private final GameRandom gameRandom;
    private final EconomyProperties properties;

    @Override
    public DuelSession challenge(String challengerId, String channelId, long bet) {
        if (bet <= 0) {
            throw new IllegalArgumentException("베팅 금액은 0보다 커야 합니다");
        }

        return stateLock.executeWithLock("duel:challenge:" + challengerId, () -> {
            creditLedger.withdraw(challengerId, bet, "결투 베팅 에스크로");
            DuelSession session = DuelSession.open(
                    SessionId.generate(challengerId, sessionRegistry.now()),
                    challengerId,
                    channelId,
                    bet,
                    sessionRegistry.now(),
                    properties.getSession().getDuelTtl()
            );
            return sessionRegistry.register(session);
        });
    }

    @Override
    public DuelOutcome accept(String sessionId, String opponentId) {
        return stateLock.executeWithLock("duel:accept:" + sessionId, () -> {
            DuelSession session = sessionRegistry.get(sessionId, DuelSession.class);
            if (session.isOwnedBy(opponentId)) {
                throw new SelfInteractionException("자기 자신과는 결투할 수 없습니다");
            }

            // 잔액 부족이면 세션 상태를 바꾸지 않고 거절
            long bet = session.getBet();
            long opponentBalance = creditLedger.getBalance(opponentId);
            if (opponentBalance < bet) {
                throw InsufficientBalanceException.of(bet, opponentBalance);
            }

            sessionRegistry.claim(sessionId, opponentId, DuelSession.class);
            try {
                creditLedger.withdraw(opponentId, bet, "결투 베팅");
            } catch (RuntimeException e) {
                cancel(session);
                throw e;
            }

            String winnerId = gameRandom.coinFlip() ? session.getChallengerId() : opponentId;
            String loserId = session.loserOf(winnerId);
            session.resolve(winnerId);
            sessionRegistry.resolve(sessionId);

            long payout = bet * 2;
            long winnerBalance = creditLedger.adjust(winnerId, payout, "결투 승리: " + sessionId);
            creditLedger.recordGame(winnerId, GameType.DUEL, true);
            creditLedger.recordGame(loserId, GameType.DUEL, false);

            log.info("[결투] 정산 완료: id={}, winner={}, loser={}, payout={}", sessionId, winnerId, loserId, payout);
            return new DuelOutcome(sessionId, winnerId, loserId, bet, payout,
                    winnerBalance, creditLedger.getBalance(loserId));
        });
    }

    private void cancel(DuelSession session) {
        Map<String, Long> refunds = session.cancel();
        sessionRegistry.resolve(session.getId());
        refunds.forEach((userId, amount) ->
                creditLedger.adjust(userId, amount, "결투 취소 환불: " + session.getId()));
        log.warn("[결투] 상대 베팅 차감 실패로 취소: id={}", session.getId());
    }
}
