package kr.socialcredit.economy.chat;

import java.util.Set;

public interface ChatActionHandler {

    /**
     * 처리하는 버튼 동작 이름 (actionId의 ':' 앞부분)
     */
    Set<String> actions();

    void handle(String action, String payload, ChatActionEvent event);
}
