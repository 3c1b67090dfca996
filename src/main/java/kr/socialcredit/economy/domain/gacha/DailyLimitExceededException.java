package kr.socialcredit.economy.domain.gacha;

/**
 * 일일 개봉/구매 한도 초과
 */
public class DailyLimitExceededException extends RuntimeException {

    public DailyLimitExceededException(String action, int limit) {
        super(String.format("오늘 %s 한도(%d회)를 모두 사용했습니다", action, limit));
    }
}
