package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.in.VoiceActivityUseCase;
import kr.socialcredit.economy.domain.account.LedgerWriteException;
import kr.socialcredit.economy.domain.voice.VoiceAccrual;
import kr.socialcredit.economy.domain.voice.VoicePresence;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * 음성 채널 체류 보상
 *
 * [정산]
 * - 입장한 사용자마다 체류 기록을 메모리에 두고, 주기적으로(또는 퇴장 시) 원장에 반영
 * - 체류 시간과 보상 크레딧은 원장 레코드 하나에 함께 저장
 * - 저장에 실패한 몫은 다음 정산에서 다시 계산
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoiceActivityService implements VoiceActivityUseCase {

    private static final String REWARD_REASON = "음성 활동 보상";

    private final CreditLedgerUseCase creditLedger;
    private final EconomyStateLock stateLock;
    private final EconomyProperties properties;
    private final Clock clock;

    // stateLock으로 보호
    private final Map<String, VoicePresence> presences = new HashMap<>();

    @Override
    public void joined(String userId) {
        stateLock.runWithLock("voice:join:" + userId, () -> {
            if (presences.containsKey(userId)) {
                return;
            }
            presences.put(userId, new VoicePresence(userId, clock.instant()));
            log.debug("[음성] 추적 시작: userId={}", userId);
        });
    }

    @Override
    public void left(String userId) {
        stateLock.runWithLock("voice:leave:" + userId, () -> {
            VoicePresence presence = presences.remove(userId);
            if (presence == null) {
                return;
            }
            if (!settle(presence)) {
                log.warn("[음성] 퇴장 정산 실패, 미반영 체류 시간 유실: userId={}", userId);
            }
            log.debug("[음성] 추적 종료: userId={}, seconds={}", userId, presence.getSecondsInChannel());
        });
    }

    @Override
    public int settleAll() {
        return stateLock.executeWithLock("voice:settle", () -> {
            int settled = 0;
            for (VoicePresence presence : presences.values()) {
                if (settle(presence)) {
                    settled++;
                }
            }
            return settled;
        });
    }

    @Override
    public int trackedCount() {
        return stateLock.executeWithLock("voice:count", presences::size);
    }

    private boolean settle(VoicePresence presence) {
        VoiceAccrual accrual = presence.pending(clock.instant(), properties.getVoice().getSecondsPerCredit());
        if (accrual.isEmpty()) {
            return true;
        }
        try {
            creditLedger.recordVoiceActivity(presence.getUserId(), accrual.seconds(), accrual.credits(), REWARD_REASON);
        } catch (LedgerWriteException e) {
            log.warn("[음성] 정산 실패: userId={}, seconds={}, credits={}, error={}",
                    presence.getUserId(), accrual.seconds(), accrual.credits(), e.getMessage());
            return false;
        }
        presence.commit(accrual);
        return true;
    }
}
