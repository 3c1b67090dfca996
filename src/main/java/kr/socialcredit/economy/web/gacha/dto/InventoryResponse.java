package kr.socialcredit.economy.web.gacha.dto;

import java.util.Map;

public record InventoryResponse(String userId, Map<String, Integer> items, Map<String, Integer> containers) {}
