package kr.socialcredit.economy.domain.voice;

import java.time.Duration;
import java.time.Instant;

/**
 * 음성 채널에 머무는 한 사용자의 체류 기록
 * - 입장 후 연속 체류 시간이 secondsPerCredit의 배수를 넘을 때마다 1크레딧
 * - pending()으로 계산하고, 저장에 성공한 뒤 commit()으로 반영한다
 */
public class VoicePresence {

    private final String userId;
    private Instant lastAccounted;
    private long secondsInChannel;

    public VoicePresence(String userId, Instant joinedAt) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("사용자 ID는 비어있을 수 없습니다");
        }
        this.userId = userId;
        this.lastAccounted = joinedAt;
    }

    /**
     * 마지막 반영 시점부터 now까지의 미반영 체류 시간과 보상
     */
    public VoiceAccrual pending(Instant now, long secondsPerCredit) {
        if (secondsPerCredit <= 0) {
            throw new IllegalArgumentException("보상 주기는 0보다 커야 합니다");
        }
        long elapsed = Math.max(0L, Duration.between(lastAccounted, now).getSeconds());
        long total = secondsInChannel + elapsed;
        long credits = total / secondsPerCredit - secondsInChannel / secondsPerCredit;
        return new VoiceAccrual(userId, lastAccounted.plusSeconds(elapsed), elapsed, credits);
    }

    public void commit(VoiceAccrual accrual) {
        this.secondsInChannel += accrual.seconds();
        this.lastAccounted = accrual.until();
    }

    public String getUserId() { return userId; }
    public long getSecondsInChannel() { return secondsInChannel; }
}
