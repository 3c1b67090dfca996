package kr.socialcredit.economy.domain.duel;

import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.SelfInteractionException;
import kr.socialcredit.economy.domain.session.Session;
import kr.socialcredit.economy.domain.session.SessionKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 2인 결투 세션
 * - 생성 시점에 도전자의 베팅이 에스크로됨 (OPEN)
 * - 상대가 수락하면 상대의 베팅도 차감된 뒤 50/50으로 승자 결정
 * - 수락 전 만료되면 도전자에게 베팅 환불
 */
public class DuelSession extends Session {

    private final long bet;
    private DuelState state;
    private String opponentId;

    private DuelSession(String id, String challengerId, String channelId, long bet,
                        Instant createdAt, Duration ttl) {
        super(id, challengerId, channelId, createdAt, ttl);
        if (bet <= 0) {
            throw new IllegalArgumentException("베팅 금액은 0보다 커야 합니다");
        }
        this.bet = bet;
        this.state = DuelState.OPEN;
    }

    public static DuelSession open(String id, String challengerId, String channelId, long bet,
                                   Instant createdAt, Duration ttl) {
        return new DuelSession(id, challengerId, channelId, bet, createdAt, ttl);
    }

    @Override
    public SessionKind kind() {
        return SessionKind.DUEL;
    }

    @Override
    public boolean isActive() {
        return !state.isFinal();
    }

    @Override
    public boolean isClaimable() {
        return state == DuelState.OPEN;
    }

    @Override
    public void claim(String claimantId) {
        if (isOwnedBy(claimantId)) {
            throw new SelfInteractionException("자기 자신과는 결투할 수 없습니다");
        }
        transitionTo(DuelState.ACCEPTED);
        this.opponentId = claimantId;
    }

    /**
     * 승자 확정
     */
    public void resolve(String winnerId) {
        if (!getOwnerId().equals(winnerId) && !winnerId.equals(opponentId)) {
            throw new IllegalArgumentException("결투 참가자가 아닙니다: " + winnerId);
        }
        transitionTo(DuelState.RESOLVED);
    }

    /**
     * 상대 차감 실패 등으로 진행할 수 없을 때 취소
     *
     * @return 도전자 환불 내역
     */
    public Map<String, Long> cancel() {
        transitionTo(DuelState.CANCELLED);
        return Map.of(getOwnerId(), bet);
    }

    @Override
    public Map<String, Long> expire() {
        if (state != DuelState.OPEN) {
            return Map.of();
        }
        transitionTo(DuelState.EXPIRED);
        return Map.of(getOwnerId(), bet);
    }

    public String loserOf(String winnerId) {
        return getOwnerId().equals(winnerId) ? opponentId : getOwnerId();
    }

    private void transitionTo(DuelState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidSessionStateException(getId(),
                    String.format("결투 상태를 변경할 수 없습니다: %s → %s",
                            state.getDisplayName(), target.getDisplayName()));
        }
        this.state = target;
    }

    public String getChallengerId() { return getOwnerId(); }
    public String getOpponentId() { return opponentId; }
    public long getBet() { return bet; }
    public DuelState getState() { return state; }
}
