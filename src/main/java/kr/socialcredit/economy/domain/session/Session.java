package kr.socialcredit.economy.domain.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * 진행 중인 게임/확인 절차를 나타내는 메모리 전용 세션
 *
 * 공통 규칙
 * - 생성 이후 레지스트리가 독점 소유하며, 종료 상태에 도달하면 제거된다
 * - 에스크로된 크레딧은 제거 전에 반드시 소유자/상대/환불 중 한 곳으로 정산된다
 * - 상태 전이는 레지스트리 락 안에서만 일어난다
 */
public abstract class Session {

    private final String id;
    private final String ownerId;
    private final String channelId;
    private final Instant createdAt;
    private final Instant expiresAt;
    private String messageId;

    protected Session(String id, String ownerId, String channelId, Instant createdAt, Duration ttl) {
        this.id = Objects.requireNonNull(id, "세션 ID는 필수입니다");
        this.ownerId = Objects.requireNonNull(ownerId, "소유자 ID는 필수입니다");
        this.channelId = channelId;
        this.createdAt = Objects.requireNonNull(createdAt, "생성 시각은 필수입니다");
        Objects.requireNonNull(ttl, "TTL은 필수입니다");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL은 0보다 커야 합니다");
        }
        this.expiresAt = createdAt.plus(ttl);
    }

    public abstract SessionKind kind();

    /**
     * 아직 종료 상태에 도달하지 않았는지
     */
    public abstract boolean isActive();

    /**
     * 두 번째 참가자가 수락할 수 있는 상태인지 (2인 게임 전용)
     */
    public boolean isClaimable() {
        return false;
    }

    /**
     * 두 번째 참가자의 수락 처리. 2인 게임만 재정의한다.
     */
    public void claim(String claimantId) {
        throw new InvalidSessionStateException(id, "수락할 수 없는 세션입니다");
    }

    /**
     * 타임아웃으로 강제 종료
     *
     * @return 환불해야 할 에스크로 (사용자 ID → 금액), 없으면 빈 맵
     */
    public abstract Map<String, Long> expire();

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    public void attachMessage(String messageId) {
        this.messageId = messageId;
    }

    public String getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getChannelId() { return channelId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public String getMessageId() { return messageId; }
}
