package kr.socialcredit.economy.application.port.out;

import java.util.Set;

/**
 * 관리자 목록 조회 포트
 */
public interface AdminDirectoryPort {

    boolean isAdmin(String userId);

    Set<String> adminIds();
}
