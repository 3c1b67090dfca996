package kr.socialcredit.economy.infrastructure.persistence.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.domain.account.GameStats;
import kr.socialcredit.economy.domain.account.GameType;

import java.util.EnumMap;
import java.util.Map;

/**
 * user:{id} 키에 JSON으로 저장되는 계정 레코드
 * 예전 형식의 rating 필드도 잔액으로 읽는다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerRecord(
        String id,
        @JsonAlias("rating") long balance,
        int duelsPlayed,
        int duelsWon,
        int coinFlipsPlayed,
        int coinFlipsWon,
        int blackjackPlayed,
        int blackjackWon,
        long voiceSeconds
) {

    public static LedgerRecord from(Account account) {
        GameStats duel = account.statsOf(GameType.DUEL);
        GameStats coinFlip = account.statsOf(GameType.COIN_FLIP);
        GameStats blackjack = account.statsOf(GameType.BLACKJACK);
        return new LedgerRecord(
                account.getId(),
                account.getBalance(),
                duel.played(), duel.won(),
                coinFlip.played(), coinFlip.won(),
                blackjack.played(), blackjack.won(),
                account.getVoiceSeconds()
        );
    }

    public Account toDomain() {
        Map<GameType, GameStats> stats = new EnumMap<>(GameType.class);
        putIfPlayed(stats, GameType.DUEL, duelsPlayed, duelsWon);
        putIfPlayed(stats, GameType.COIN_FLIP, coinFlipsPlayed, coinFlipsWon);
        putIfPlayed(stats, GameType.BLACKJACK, blackjackPlayed, blackjackWon);
        return Account.restore(id, Math.max(0L, balance), stats, Math.max(0L, voiceSeconds));
    }

    public LedgerRecord withId(String id) {
        return new LedgerRecord(id, balance, duelsPlayed, duelsWon, coinFlipsPlayed, coinFlipsWon,
                blackjackPlayed, blackjackWon, voiceSeconds);
    }

    private static void putIfPlayed(Map<GameType, GameStats> stats, GameType type, int played, int won) {
        if (played > 0) {
            stats.put(type, new GameStats(played, Math.min(won, played)));
        }
    }
}
