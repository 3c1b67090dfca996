package kr.socialcredit.economy.application.port.in;

import kr.socialcredit.economy.domain.blackjack.BlackjackSession;

import java.util.Optional;

public interface BlackjackUseCase {

    BlackjackSession start(String playerId, String channelId);

    BlackjackSession bet(String playerId, long amount);

    BlackjackSession hit(String sessionId, String actorId);

    BlackjackSession stand(String sessionId, String actorId);

    BlackjackSession replay(String actorId, String ownerId, String channelId);

    /**
     * 관리자 강제 종료. 베팅이 있으면 환불한다.
     *
     * @return 종료된 세션, 진행 중인 게임이 없으면 empty
     */
    Optional<BlackjackSession> forceEnd(String adminId, String targetId);
}
