package kr.socialcredit.economy.application.port.out;

/**
 * 메시지에 붙는 버튼
 */
public record MessageAction(String actionId, String label, Style style) {

    public enum Style {
        PRIMARY, SECONDARY, SUCCESS, DANGER
    }

    public static MessageAction primary(String actionId, String label) {
        return new MessageAction(actionId, label, Style.PRIMARY);
    }

    public static MessageAction secondary(String actionId, String label) {
        return new MessageAction(actionId, label, Style.SECONDARY);
    }

    public static MessageAction success(String actionId, String label) {
        return new MessageAction(actionId, label, Style.SUCCESS);
    }

    public static MessageAction danger(String actionId, String label) {
        return new MessageAction(actionId, label, Style.DANGER);
    }
}
