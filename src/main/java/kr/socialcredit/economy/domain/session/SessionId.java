package kr.socialcredit.economy.domain.session;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 세션 ID 생성기
 * 형식: {참가자ID}-{epochMillis}-{랜덤 6자리}
 */
public final class SessionId {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;

    private SessionId() {
    }

    public static String generate(String ownerId, Instant now) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("세션 소유자 ID는 비어있을 수 없습니다");
        }
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return ownerId + "-" + now.toEpochMilli() + "-" + suffix;
    }
}
