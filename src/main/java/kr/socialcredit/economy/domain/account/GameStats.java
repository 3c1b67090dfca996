package kr.socialcredit.economy.domain.account;

/**
 * 게임별 누적 전적 (플레이 수 / 승리 수)
 */
public record GameStats(int played, int won) {

    public static final GameStats EMPTY = new GameStats(0, 0);

    public GameStats {
        if (played < 0 || won < 0 || won > played) {
            throw new IllegalArgumentException(
                    String.format("잘못된 전적입니다: played=%d, won=%d", played, won));
        }
    }

    public static GameStats single(boolean won) {
        return new GameStats(1, won ? 1 : 0);
    }

    public GameStats plus(GameStats other) {
        return new GameStats(played + other.played, won + other.won);
    }

    public int lost() {
        return played - won;
    }
}
