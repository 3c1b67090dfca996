package kr.socialcredit.economy.domain.voice;

import java.time.Instant;

/**
 * 아직 저장되지 않은 음성 체류 시간과 그에 대한 보상 크레딧
 */
public record VoiceAccrual(String userId, Instant until, long seconds, long credits) {

    public boolean isEmpty() {
        return seconds == 0 && credits == 0;
    }
}
