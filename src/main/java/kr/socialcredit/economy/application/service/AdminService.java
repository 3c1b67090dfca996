package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.AdminUseCase;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.out.AdminDirectoryPort;
import kr.socialcredit.economy.domain.common.exception.AdminOnlyException;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 관리자 잔액 조정
 * 음수 조정도 일반 조정과 같이 0에서 멈춘다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService implements AdminUseCase {

    private final CreditLedgerUseCase creditLedger;
    private final AdminDirectoryPort adminDirectory;
    private final EconomyStateLock stateLock;

    @Override
    public AdjustResult adjust(AdjustCommand command) {
        requireAdmin(command.adminId());
        if (command.delta() == 0) {
            throw new IllegalArgumentException("조정 금액은 0이 아니어야 합니다");
        }
        return stateLock.executeWithLock("admin:adjust:" + command.targetId(), () -> {
            long previous = creditLedger.getBalance(command.targetId());
            long updated = creditLedger.adjust(command.targetId(), command.delta(), adminReason(command.adminId(), command.reason()));
            log.info("[관리자] 잔액 조정: admin={}, target={}, delta={}, {} → {}",
                    command.adminId(), command.targetId(), command.delta(), previous, updated);
            return new AdjustResult(command.targetId(), previous, updated);
        });
    }

    @Override
    public List<AdjustResult> mass(MassCommand command) {
        requireAdmin(command.adminId());
        if (command.amount() < 0) {
            throw new IllegalArgumentException("금액은 0 이상이어야 합니다");
        }
        if (command.targetIds() == null || command.targetIds().isEmpty()) {
            throw new IllegalArgumentException("대상 사용자를 한 명 이상 지정하세요");
        }

        String reason = adminReason(command.adminId(), command.reason());
        return stateLock.executeWithLock("admin:mass", () -> {
            List<AdjustResult> results = new ArrayList<>();
            for (String targetId : new LinkedHashSet<>(command.targetIds())) {
                long previous = creditLedger.getBalance(targetId);
                long delta = switch (command.operation()) {
                    case ADD -> command.amount();
                    case SUBTRACT -> -command.amount();
                    case SET -> command.amount() - previous;
                };
                long updated = creditLedger.adjust(targetId, delta, reason);
                results.add(new AdjustResult(targetId, previous, updated));
            }
            log.info("[관리자] 일괄 조정: admin={}, op={}, amount={}, targets={}",
                    command.adminId(), command.operation(), command.amount(), results.size());
            return results;
        });
    }

    @Override
    public boolean isAdmin(String userId) {
        return adminDirectory.isAdmin(userId);
    }

    private void requireAdmin(String userId) {
        if (!adminDirectory.isAdmin(userId)) {
            throw new AdminOnlyException();
        }
    }

    private static String adminReason(String adminId, String reason) {
        String detail = (reason == null || reason.isBlank()) ? "사유 없음" : reason;
        return "관리자 조정(" + adminId + "): " + detail;
    }
}
