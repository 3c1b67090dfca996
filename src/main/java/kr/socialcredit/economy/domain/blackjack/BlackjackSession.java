package kr.socialcredit.economy.domain.blackjack;

import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.Session;
import kr.socialcredit.economy.domain.session.SessionKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 블랙잭 세션
 * - AWAITING_BET: 생성 직후, 에스크로 없음
 * - PLAYER_TURN: 베팅 차감 후 카드 배분, hit/stand 대기
 * - RESOLVED: 정산 완료
 * - EXPIRED / CANCELLED: 타임아웃 또는 관리자 종료, 베팅이 있으면 환불
 */
public class BlackjackSession extends Session {

    private static final int DEALER_STANDS_AT = 17;

    private BlackjackState state;
    private long bet;
    private Deck deck;
    private final Hand playerHand = new Hand();
    private final Hand dealerHand = new Hand();
    private BlackjackOutcome outcome;

    private BlackjackSession(String id, String playerId, String channelId, Instant createdAt, Duration ttl) {
        super(id, playerId, channelId, createdAt, ttl);
        this.state = BlackjackState.AWAITING_BET;
    }

    public static BlackjackSession start(String id, String playerId, String channelId,
                                         Instant createdAt, Duration ttl) {
        return new BlackjackSession(id, playerId, channelId, createdAt, ttl);
    }

    @Override
    public SessionKind kind() {
        return SessionKind.BLACKJACK;
    }

    @Override
    public boolean isActive() {
        return !state.isFinal();
    }

    /**
     * 베팅 후 플레이어/딜러에게 두 장씩 배분 (크레딧 차감은 호출자가 먼저 수행)
     */
    public void deal(long amount, Deck deck) {
        if (amount <= 0) {
            throw new IllegalArgumentException("베팅 금액은 0보다 커야 합니다");
        }
        transitionTo(BlackjackState.PLAYER_TURN);
        this.bet = amount;
        this.deck = deck;
        playerHand.add(deck.draw());
        playerHand.add(deck.draw());
        dealerHand.add(deck.draw());
        dealerHand.add(deck.draw());
    }

    /**
     * 카드 한 장 추가. 21을 넘으면 즉시 패배로 종료된다.
     *
     * @return 버스트로 종료되었으면 true
     */
    public boolean hit() {
        requirePlayerTurn();
        playerHand.add(deck.draw());
        if (playerHand.isBust()) {
            finish(BlackjackOutcome.PLAYER_BUST);
            return true;
        }
        return false;
    }

    /**
     * 딜러가 17 이상이 될 때까지 뽑은 뒤 판정
     */
    public BlackjackOutcome stand() {
        requirePlayerTurn();
        while (dealerHand.total() < DEALER_STANDS_AT && deck.remaining() > 0) {
            dealerHand.add(deck.draw());
        }
        int player = playerHand.total();
        int dealer = dealerHand.total();
        BlackjackOutcome result;
        if (dealer > Hand.BLACKJACK) {
            result = BlackjackOutcome.DEALER_BUST;
        } else if (player > dealer) {
            result = BlackjackOutcome.PLAYER_WIN;
        } else if (player == dealer) {
            result = BlackjackOutcome.PUSH;
        } else {
            result = BlackjackOutcome.DEALER_WIN;
        }
        finish(result);
        return result;
    }

    /**
     * 관리자 강제 종료
     *
     * @return 환불할 에스크로
     */
    public Map<String, Long> cancel() {
        Map<String, Long> refund = outstandingEscrow();
        transitionTo(BlackjackState.CANCELLED);
        return refund;
    }

    @Override
    public Map<String, Long> expire() {
        if (state.isFinal()) {
            return Map.of();
        }
        Map<String, Long> refund = outstandingEscrow();
        transitionTo(BlackjackState.EXPIRED);
        return refund;
    }

    public long payout() {
        return outcome == null ? 0L : outcome.payoutFor(bet);
    }

    private Map<String, Long> outstandingEscrow() {
        return state == BlackjackState.PLAYER_TURN ? Map.of(getOwnerId(), bet) : Map.of();
    }

    private void finish(BlackjackOutcome result) {
        transitionTo(BlackjackState.RESOLVED);
        this.outcome = result;
    }

    private void requirePlayerTurn() {
        if (state != BlackjackState.PLAYER_TURN) {
            throw new InvalidSessionStateException(getId(), "지금은 카드를 받을 수 없습니다. 먼저 베팅하세요");
        }
    }

    private void transitionTo(BlackjackState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidSessionStateException(getId(),
                    String.format("블랙잭 상태를 변경할 수 없습니다: %s → %s",
                            state.getDisplayName(), target.getDisplayName()));
        }
        this.state = target;
    }

    public BlackjackState getState() { return state; }
    public long getBet() { return bet; }
    public Hand getPlayerHand() { return playerHand; }
    public Hand getDealerHand() { return dealerHand; }
    public BlackjackOutcome getOutcome() { return outcome; }
}
