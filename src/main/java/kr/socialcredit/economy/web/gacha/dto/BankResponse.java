package kr.socialcredit.economy.web.gacha.dto;

import java.time.Instant;
import java.util.Map;

public record BankResponse(Map<String, Integer> stock, Instant lastRefilled) {}
