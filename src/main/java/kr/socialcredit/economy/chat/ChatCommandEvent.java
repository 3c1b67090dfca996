package kr.socialcredit.economy.chat;

/**
 * 채팅 명령 수신 이벤트
 */
public record ChatCommandEvent(String commandText, String authorId, String channelId) {
}
