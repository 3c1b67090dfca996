package kr.socialcredit.economy.application.port.in;

import kr.socialcredit.economy.domain.duel.DuelOutcome;
import kr.socialcredit.economy.domain.duel.DuelSession;

public interface DuelUseCase {

    /**
     * 결투 생성. 도전자의 베팅이 즉시 에스크로된다.
     */
    DuelSession challenge(String challengerId, String channelId, long bet);

    /**
     * 결투 수락 및 즉시 정산
     */
    DuelOutcome accept(String sessionId, String opponentId);
}
