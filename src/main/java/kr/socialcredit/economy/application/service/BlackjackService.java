package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.BlackjackUseCase;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.out.AdminDirectoryPort;
import kr.socialcredit.economy.domain.account.GameType;
import kr.socialcredit.economy.domain.blackjack.BlackjackSession;
import kr.socialcredit.economy.domain.blackjack.BlackjackState;
import kr.socialcredit.economy.domain.blackjack.Deck;
import kr.socialcredit.economy.domain.common.GameRandom;
import kr.socialcredit.economy.domain.common.exception.AdminOnlyException;
import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.NotSessionOwnerException;
import kr.socialcredit.economy.domain.session.SessionId;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * 블랙잭 서비스
 * 세션은 사용자당 하나만 진행할 수 있고, 모든 상태 변경은 락 안에서 수행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlackjackService implements BlackjackUseCase {

    private final SessionRegistry sessionRegistry;
    private final CreditLedgerUseCase creditLedger;
    private final AdminDirectoryPort adminDirectory;
    private final EconomyStateLock stateLock;
    private final GameRandom gameRandom;
    private final EconomyProperties properties;

    @Override
    public BlackjackSession start(String playerId, String channelId) {
        return stateLock.executeWithLock("blackjack:start:" + playerId, () -> {
            if (sessionRegistry.findActiveByOwner(playerId, BlackjackSession.class, s -> true).isPresent()) {
                throw new InvalidSessionStateException(null, "이미 진행 중인 블랙잭 게임이 있습니다");
            }
            return sessionRegistry.register(BlackjackSession.start(
                    SessionId.generate(playerId, sessionRegistry.now()),
                    playerId,
                    channelId,
                    sessionRegistry.now(),
                    properties.getSession().getBlackjackTtl()
            ));
        });
    }

    @Override
    public BlackjackSession bet(String playerId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("베팅 금액은 0보다 커야 합니다");
        }
        return stateLock.executeWithLock("blackjack:bet:" + playerId, () -> {
            BlackjackSession session = sessionRegistry.findActiveByOwner(playerId, BlackjackSession.class,
                            s -> s.getState() == BlackjackState.AWAITING_BET)
                    .orElseThrow(() -> new InvalidSessionStateException(null, "먼저 !blackjack 으로 게임을 시작하세요"));

            creditLedger.withdraw(playerId, amount, "블랙잭 베팅");
            session.deal(amount, Deck.shuffled(gameRandom));
            log.info("[블랙잭] 베팅: id={}, player={}, bet={}", session.getId(), playerId, amount);
            return session;
        });
    }

    @Override
    public BlackjackSession hit(String sessionId, String actorId) {
        return stateLock.executeWithLock("blackjack:hit:" + sessionId, () -> {
            BlackjackSession session = sessionRegistry.requireOwned(sessionId, actorId, BlackjackSession.class);
            if (session.hit()) {
                settle(session);
            }
            return session;
        });
    }

    @Override
    public BlackjackSession stand(String sessionId, String actorId) {
        return stateLock.executeWithLock("blackjack:stand:" + sessionId, () -> {
            BlackjackSession session = sessionRegistry.requireOwned(sessionId, actorId, BlackjackSession.class);
            session.stand();
            settle(session);
            return session;
        });
    }

    @Override
    public BlackjackSession replay(String actorId, String ownerId, String channelId) {
        if (!actorId.equals(ownerId)) {
            throw new NotSessionOwnerException(null, actorId);
        }
        return start(ownerId, channelId);
    }

    @Override
    public Optional<BlackjackSession> forceEnd(String adminId, String targetId) {
        if (!adminDirectory.isAdmin(adminId)) {
            throw new AdminOnlyException();
        }
        return stateLock.executeWithLock("blackjack:forceEnd:" + targetId, () -> {
            Optional<BlackjackSession> active =
                    sessionRegistry.findActiveByOwner(targetId, BlackjackSession.class, s -> true);
            active.ifPresent(session -> {
                Map<String, Long> refunds = session.cancel();
                sessionRegistry.resolve(session.getId());
                refunds.forEach((userId, amount) ->
                        creditLedger.adjust(userId, amount, "블랙잭 강제 종료 환불: " + session.getId()));
                log.info("[블랙잭] 관리자 강제 종료: id={}, admin={}, refunds={}", session.getId(), adminId, refunds);
            });
            return active;
        });
    }

    private void settle(BlackjackSession session) {
        sessionRegistry.resolve(session.getId());
        long payout = session.payout();
        if (payout > 0) {
            creditLedger.adjust(session.getOwnerId(), payout,
                    "블랙잭 " + session.getOutcome().getDisplayName() + ": " + session.getId());
        }
        creditLedger.recordGame(session.getOwnerId(), GameType.BLACKJACK, session.getOutcome().isPlayerWon());
        log.info("[블랙잭] 정산 완료: id={}, outcome={}, player={}, dealer={}, payout={}",
                session.getId(), session.getOutcome(),
                session.getPlayerHand().total(), session.getDealerHand().total(), payout);
    }
}
