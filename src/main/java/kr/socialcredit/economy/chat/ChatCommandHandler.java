package kr.socialcredit.economy.chat;

import java.util.List;
import java.util.Set;

public interface ChatCommandHandler {

    /**
     * 처리하는 명령 이름 (접두사 ! 제외, 소문자)
     */
    Set<String> commands();

    void handle(String command, List<String> args, ChatCommandEvent event);
}
