package kr.socialcredit.economy.domain.casino;

import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.Session;
import kr.socialcredit.economy.domain.session.SessionKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 1인 레드블랙 라운드
 * AWAITING_BET → IN_PROGRESS → RESOLVED, 베팅 전에는 AWAITING_BET → EXPIRED
 * 다시하기는 이 세션을 재사용하지 않고 새 세션을 만든다.
 */
public class CoinFlipSession extends Session {

    private CoinFlipState state;
    private CoinSide chosen;
    private long bet;

    private CoinFlipSession(String id, String playerId, String channelId, Instant createdAt, Duration ttl) {
        super(id, playerId, channelId, createdAt, ttl);
        this.state = CoinFlipState.AWAITING_BET;
    }

    public static CoinFlipSession start(String id, String playerId, String channelId,
                                        Instant createdAt, Duration ttl) {
        return new CoinFlipSession(id, playerId, channelId, createdAt, ttl);
    }

    @Override
    public SessionKind kind() {
        return SessionKind.COIN_FLIP;
    }

    @Override
    public boolean isActive() {
        return !state.isFinal();
    }

    /**
     * 베팅 확정 (크레딧 차감은 호출자가 먼저 수행)
     */
    public void placeBet(CoinSide side, long amount) {
        if (side == null) {
            throw new IllegalArgumentException("red 또는 black 중 하나를 선택하세요");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("베팅 금액은 0보다 커야 합니다");
        }
        transitionTo(CoinFlipState.IN_PROGRESS);
        this.chosen = side;
        this.bet = amount;
    }

    /**
     * 결과 확정
     *
     * @return 지급해야 할 금액 (승리 시 베팅의 2배, 패배 시 0)
     */
    public long settle(CoinSide outcome) {
        transitionTo(CoinFlipState.RESOLVED);
        return outcome == chosen ? bet * 2 : 0L;
    }

    @Override
    public Map<String, Long> expire() {
        if (state.isFinal()) {
            return Map.of();
        }
        boolean escrowed = state == CoinFlipState.IN_PROGRESS;
        transitionTo(CoinFlipState.EXPIRED);
        return escrowed ? Map.of(getOwnerId(), bet) : Map.of();
    }

    private void transitionTo(CoinFlipState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidSessionStateException(getId(),
                    String.format("이미 베팅했거나 종료된 라운드입니다 (%s)", state.getDisplayName()));
        }
        this.state = target;
    }

    public CoinFlipState getState() { return state; }
    public CoinSide getChosen() { return chosen; }
    public long getBet() { return bet; }
}
