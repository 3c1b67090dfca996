package kr.socialcredit.economy.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 명령 인자 파싱 도우미
 */
public final class ChatArguments {

    private static final Pattern MENTION = Pattern.compile("^<@!?(\\d+)>$");
    private static final Pattern RAW_ID = Pattern.compile("^\\d{5,}$");

    private ChatArguments() {
    }

    /**
     * 양의 정수 금액
     */
    public static long amount(String raw) {
        try {
            long value = Long.parseLong(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException("금액은 양의 정수여야 합니다: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("금액은 양의 정수여야 합니다: " + raw);
        }
    }

    /**
     * 부호가 있는 정수 (+100, -50)
     */
    public static long signedAmount(String raw) {
        try {
            long value = Long.parseLong(raw.trim());
            if (value == 0) {
                throw new IllegalArgumentException("0이 아닌 정수를 입력하세요");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("정수를 입력하세요: " + raw);
        }
    }

    public static int quantity(String raw) {
        long value = amount(raw);
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("수량이 너무 큽니다: " + raw);
        }
        return (int) value;
    }

    public static boolean isMention(String raw) {
        return MENTION.matcher(raw).matches() || RAW_ID.matcher(raw).matches();
    }

    /**
     * <@123>, <@!123> 또는 숫자 ID에서 사용자 ID 추출
     */
    public static String userId(String raw) {
        Matcher matcher = MENTION.matcher(raw);
        if (matcher.matches()) {
            return matcher.group(1);
        }
        if (RAW_ID.matcher(raw).matches()) {
            return raw;
        }
        throw new IllegalArgumentException("사용자를 멘션하세요: " + raw);
    }

    /**
     * 앞에서부터 연속된 멘션을 사용자 ID 목록으로
     */
    public static List<String> leadingMentions(List<String> args) {
        List<String> ids = new ArrayList<>();
        for (String arg : args) {
            if (!isMention(arg)) {
                break;
            }
            ids.add(userId(arg));
        }
        return ids;
    }

    public static String joinFrom(List<String> args, int from) {
        if (from >= args.size()) {
            return "";
        }
        return String.join(" ", args.subList(from, args.size()));
    }

    public static String mention(String userId) {
        return "<@" + userId + ">";
    }
}
