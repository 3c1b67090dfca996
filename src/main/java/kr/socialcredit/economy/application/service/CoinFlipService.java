package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.CoinFlipUseCase;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.domain.account.GameType;
import kr.socialcredit.economy.domain.casino.CoinFlipResult;
import kr.socialcredit.economy.domain.casino.CoinFlipSession;
import kr.socialcredit.economy.domain.casino.CoinFlipState;
import kr.socialcredit.economy.domain.casino.CoinSide;
import kr.socialcredit.economy.domain.common.GameRandom;
import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.NotSessionOwnerException;
import kr.socialcredit.economy.domain.session.SessionId;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 레드블랙 서비스
 * 베팅과 정산은 락 안에서 한 번에 끝나고, 연출용 중간 화면은 호출자가 락 밖에서 보여준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoinFlipService implements CoinFlipUseCase {

    private final SessionRegistry sessionRegistry;
    private final CreditLedgerUseCase creditLedger;
    private final EconomyStateLock stateLock;
    private final GameRandom gameRandom;
    private final EconomyProperties properties;

    @Override
    public CoinFlipSession start(String playerId, String channelId) {
        return stateLock.executeWithLock("coinflip:start:" + playerId, () ->
                sessionRegistry.findActiveByOwner(playerId, CoinFlipSession.class,
                                s -> s.getState() == CoinFlipState.AWAITING_BET)
                        .orElseGet(() -> sessionRegistry.register(CoinFlipSession.start(
                                SessionId.generate(playerId, sessionRegistry.now()),
                                playerId,
                                channelId,
                                sessionRegistry.now(),
                                properties.getSession().getCasinoTtl()
                        ))));
    }

    @Override
    public CoinFlipResult placeBet(String playerId, CoinSide side, long amount) {
        if (side == null) {
            throw new IllegalArgumentException("red 또는 black 중 하나를 선택하세요");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("베팅 금액은 0보다 커야 합니다");
        }

        return stateLock.executeWithLock("coinflip:bet:" + playerId, () -> {
            CoinFlipSession session = sessionRegistry.findActiveByOwner(playerId, CoinFlipSession.class,
                            s -> s.getState() == CoinFlipState.AWAITING_BET)
                    .orElseThrow(() -> new InvalidSessionStateException(null, "먼저 !rb 로 게임을 시작하세요"));

            creditLedger.withdraw(playerId, amount, "레드블랙 베팅");
            session.placeBet(side, amount);

            CoinSide outcome = CoinSide.fromIndex(gameRandom.nextInt(2));
            long payout = session.settle(outcome);
            sessionRegistry.resolve(session.getId());

            long balance = payout > 0
                    ? creditLedger.adjust(playerId, payout, "레드블랙 승리: " + session.getId())
                    : creditLedger.getBalance(playerId);
            creditLedger.recordGame(playerId, GameType.COIN_FLIP, outcome == side);

            log.info("[레드블랙] 정산 완료: id={}, player={}, chosen={}, outcome={}, payout={}",
                    session.getId(), playerId, side, outcome, payout);
            return new CoinFlipResult(session.getId(), playerId, side, outcome, amount, payout, balance);
        });
    }

    @Override
    public CoinFlipSession replay(String actorId, String ownerId, String channelId) {
        if (!actorId.equals(ownerId)) {
            throw new NotSessionOwnerException(null, actorId);
        }
        return start(ownerId, channelId);
    }
}
