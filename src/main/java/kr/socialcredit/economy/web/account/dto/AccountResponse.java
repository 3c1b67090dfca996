package kr.socialcredit.economy.web.account.dto;

import kr.socialcredit.economy.domain.account.Account;
import kr.socialcredit.economy.domain.account.GameStats;
import kr.socialcredit.economy.domain.account.GameType;

import java.util.EnumMap;
import java.util.Map;

public record AccountResponse(
        String userId,
        long balance,
        Map<GameType, StatsResponse> stats,
        long voiceSeconds
) {

    public record StatsResponse(int played, int won, int lost) {}

    public static AccountResponse from(Account account) {
        Map<GameType, StatsResponse> stats = new EnumMap<>(GameType.class);
        for (GameType type : GameType.values()) {
            GameStats s = account.statsOf(type);
            stats.put(type, new StatsResponse(s.played(), s.won(), s.lost()));
        }
        return new AccountResponse(account.getId(), account.getBalance(), stats, account.getVoiceSeconds());
    }
}
