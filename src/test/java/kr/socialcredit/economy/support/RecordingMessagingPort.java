package kr.socialcredit.economy.support;

import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.application.port.out.MessagingPort;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

public class RecordingMessagingPort implements MessagingPort {

    public record Sent(String channelId, String messageId, String text, List<MessageAction> actions) {}

    public record Edited(String channelId, String messageId, String text, List<MessageAction> actions) {}

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final List<Edited> edited = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public void sendMessage(String channelId, String text) {
        sent.add(new Sent(channelId, null, text, List.of()));
    }

    @Override
    public String sendMessageWithActions(String channelId, String text, List<MessageAction> actions) {
        String messageId = "msg-" + sequence.incrementAndGet();
        sent.add(new Sent(channelId, messageId, text, actions));
        return messageId;
    }

    @Override
    public void editMessage(String channelId, String messageId, String text, List<MessageAction> actions) {
        edited.add(new Edited(channelId, messageId, text, actions));
    }

    public List<Sent> sent() {
        return sent;
    }

    public List<Edited> edited() {
        return edited;
    }

    public Sent lastSent() {
        return sent.get(sent.size() - 1);
    }

    public Edited lastEdited() {
        return edited.get(edited.size() - 1);
    }
}
