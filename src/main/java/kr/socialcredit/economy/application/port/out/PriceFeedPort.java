package kr.socialcredit.economy.application.port.out;

import java.util.OptionalDouble;

/**
 * 외부 기준 시세 피드 (예: BTC/USD)
 */
public interface PriceFeedPort {

    /**
     * @return 현재 시세, 조회 실패 시 empty
     */
    OptionalDouble fetchCurrentPrice();
}
