package kr.socialcredit.economy.domain.gacha;

import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.Session;
import kr.socialcredit.economy.domain.session.SessionKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 아이템 판매 확인 세션
 * - 요청 시점의 단가를 고정해 두고, 소유자가 확인할 때만 인벤토리와 잔액을 변경한다
 * - 확인 전에는 아무것도 에스크로하지 않으므로 만료/취소 시 환불이 없다
 */
public class SaleConfirmationSession extends Session {

    private final String itemId;
    private final int quantity;
    private final long unitPrice;
    private SaleState state;

    private SaleConfirmationSession(String id, String sellerId, String channelId, String itemId,
                                    int quantity, long unitPrice, Instant createdAt, Duration ttl) {
        super(id, sellerId, channelId, createdAt, ttl);
        if (quantity <= 0) {
            throw new IllegalArgumentException("판매 수량은 0보다 커야 합니다");
        }
        this.itemId = itemId;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.state = SaleState.PENDING;
    }

    public static SaleConfirmationSession request(String id, String sellerId, String channelId,
                                                  String itemId, int quantity, long unitPrice,
                                                  Instant createdAt, Duration ttl) {
        return new SaleConfirmationSession(id, sellerId, channelId, itemId, quantity, unitPrice, createdAt, ttl);
    }

    @Override
    public SessionKind kind() {
        return SessionKind.SALE;
    }

    @Override
    public boolean isActive() {
        return state == SaleState.PENDING;
    }

    /**
     * 판매 대금: floor(단가 / 2) × 수량
     */
    public long proceeds() {
        return (unitPrice / 2) * quantity;
    }

    public void confirm() {
        transitionTo(SaleState.CONFIRMED);
    }

    public void cancel() {
        transitionTo(SaleState.CANCELLED);
    }

    @Override
    public Map<String, Long> expire() {
        if (state == SaleState.PENDING) {
            transitionTo(SaleState.EXPIRED);
        }
        return Map.of();
    }

    private void transitionTo(SaleState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidSessionStateException(getId(), "이미 처리된 판매 요청입니다");
        }
        this.state = target;
    }

    public String getItemId() { return itemId; }
    public int getQuantity() { return quantity; }
    public long getUnitPrice() { return unitPrice; }
    public SaleState getState() { return state; }
}
