package kr.socialcredit.economy.domain.account;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 사용자 계정 애그리게이트
 * - 처음 참조될 때 잔액 0으로 생성되고 삭제되지 않음
 * - 잔액은 항상 0 이상: 음수 delta가 잔액을 넘으면 0에서 멈춤 (거절하지 않음)
 * - 게임별 누적 전적, 음성 채널 누적 시간 관리
 */
public class Account {

    private final String id;
    private long balance;
    private final Map<GameType, GameStats> stats;
    private long voiceSeconds;

    private Account(String id, long balance, Map<GameType, GameStats> stats, long voiceSeconds) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("사용자 ID는 비어있을 수 없습니다");
        }
        if (balance < 0) {
            throw new IllegalArgumentException("잔액은 0 이상이어야 합니다");
        }
        if (voiceSeconds < 0) {
            throw new IllegalArgumentException("음성 시간은 0 이상이어야 합니다");
        }
        this.id = id;
        this.balance = balance;
        this.stats = new EnumMap<>(GameType.class);
        this.stats.putAll(stats);
        this.voiceSeconds = voiceSeconds;
    }

    public static Account open(String id) {
        return new Account(id, 0L, Map.of(), 0L);
    }

    public static Account restore(String id, long balance, Map<GameType, GameStats> stats) {
        return restore(id, balance, stats, 0L);
    }

    public static Account restore(String id, long balance, Map<GameType, GameStats> stats, long voiceSeconds) {
        return new Account(id, balance, Objects.requireNonNull(stats, "전적은 필수입니다"), voiceSeconds);
    }

    /**
     * delta 적용 후 새 잔액 반환
     * 매 호출마다 0에서 고정되므로 여러 delta를 한 번에 합산한 결과와 다를 수 있다.
     *
     * @throws BalanceOverflowException 결과가 long 범위를 넘으면 (잔액은 바뀌지 않음)
     */
    public long applyDelta(long delta) {
        long next;
        try {
            next = Math.addExact(balance, delta);
        } catch (ArithmeticException e) {
            throw new BalanceOverflowException(balance, delta);
        }
        this.balance = Math.max(0L, next);
        return balance;
    }

    public void recordGame(GameType type, boolean won) {
        stats.merge(type, GameStats.single(won), GameStats::plus);
    }

    public void addVoiceSeconds(long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("음성 시간은 0 이상이어야 합니다");
        }
        this.voiceSeconds += seconds;
    }

    public boolean canAfford(long amount) {
        return balance >= amount;
    }

    public GameStats statsOf(GameType type) {
        return stats.getOrDefault(type, GameStats.EMPTY);
    }

    public Map<GameType, GameStats> getStats() {
        return Collections.unmodifiableMap(stats);
    }

    public String getId() { return id; }
    public long getBalance() { return balance; }
    public long getVoiceSeconds() { return voiceSeconds; }
}
