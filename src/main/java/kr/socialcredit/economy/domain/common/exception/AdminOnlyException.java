package kr.socialcredit.economy.domain.common.exception;

/**
 * 관리자 전용 명령을 일반 사용자가 호출한 경우
 */
public class AdminOnlyException extends RuntimeException {

    public AdminOnlyException() {
        super("관리자만 사용할 수 있는 명령입니다");
    }
}
