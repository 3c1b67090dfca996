package kr.socialcredit.economy.chat;

/**
 * 버튼 ID 형식: {동작}:{값}
 */
public final class ActionIds {

    public static final String DUEL_ACCEPT = "duel_accept";
    public static final String RB_REPLAY = "rb_replay";
    public static final String BJ_HIT = "bj_hit";
    public static final String BJ_STAND = "bj_stand";
    public static final String BJ_REPLAY = "bj_replay";
    public static final String SALE_CONFIRM = "sale_confirm";
    public static final String SALE_CANCEL = "sale_cancel";

    private static final char SEPARATOR = ':';

    private ActionIds() {
    }

    public static String of(String action, String payload) {
        return action + SEPARATOR + payload;
    }

    public static String actionOf(String actionId) {
        int index = actionId.indexOf(SEPARATOR);
        return index < 0 ? actionId : actionId.substring(0, index);
    }

    public static String payloadOf(String actionId) {
        int index = actionId.indexOf(SEPARATOR);
        return index < 0 ? "" : actionId.substring(index + 1);
    }
}
