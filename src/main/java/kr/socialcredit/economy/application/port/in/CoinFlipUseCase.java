package kr.socialcredit.economy.application.port.in;

import kr.socialcredit.economy.domain.casino.CoinFlipResult;
import kr.socialcredit.economy.domain.casino.CoinFlipSession;
import kr.socialcredit.economy.domain.casino.CoinSide;

public interface CoinFlipUseCase {

    CoinFlipSession start(String playerId, String channelId);

    /**
     * 대기 중인 라운드에 베팅하고 정산
     */
    CoinFlipResult placeBet(String playerId, CoinSide side, long amount);

    /**
     * 종료된 라운드의 다시하기. 항상 새 세션을 만든다.
     */
    CoinFlipSession replay(String actorId, String ownerId, String channelId);
}
