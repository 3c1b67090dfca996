package kr.socialcredit.economy.web.account.dto;

public record LeaderboardEntry(int rank, String userId, long balance) {}
