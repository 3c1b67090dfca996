package kr.socialcredit.economy.application.port.out;

import java.util.List;

/**
 * 채팅 플랫폼 외부 포트
 */
public interface MessagingPort {

    void sendMessage(String channelId, String text);

    /**
     * @return 전송된 메시지 ID
     */
    String sendMessageWithActions(String channelId, String text, List<MessageAction> actions);

    /**
     * 메시지 내용과 버튼을 교체. 빈 목록이면 버튼을 제거한다.
     */
    void editMessage(String channelId, String messageId, String text, List<MessageAction> actions);
}
