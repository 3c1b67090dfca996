package kr.socialcredit.economy.domain.casino;

import java.util.Locale;

/**
 * 레드블랙 선택지
 */
public enum CoinSide {

    RED("레드", "🔴"),
    BLACK("블랙", "⚫");

    private final String displayName;
    private final String symbol;

    CoinSide(String displayName, String symbol) {
        this.displayName = displayName;
        this.symbol = symbol;
    }

    /**
     * 명령 인자에서 선택지 파싱 (red/black, 레드/블랙)
     */
    public static CoinSide parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("red 또는 black 중 하나를 선택하세요");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "red", "r", "레드" -> RED;
            case "black", "b", "블랙" -> BLACK;
            default -> throw new IllegalArgumentException("red 또는 black 중 하나를 선택하세요: " + raw);
        };
    }

    public static CoinSide fromIndex(int index) {
        return index == 0 ? RED : BLACK;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSymbol() {
        return symbol;
    }
}
