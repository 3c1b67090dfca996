package kr.socialcredit.economy.domain.gacha;

public enum SaleState {

    PENDING("확인 대기"),
    CONFIRMED("판매 완료"),
    CANCELLED("취소"),
    EXPIRED("만료");

    private final String displayName;

    SaleState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(SaleState target) {
        return this == PENDING && target != PENDING;
    }
}
