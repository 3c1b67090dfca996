package kr.socialcredit.economy.chat;

/**
 * 버튼 클릭 수신 이벤트
 */
public record ChatActionEvent(String actionId, String actorId, String channelId, String sourceMessageId) {
}
