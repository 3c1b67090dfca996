package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.event.SessionExpiredEvent;
import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.domain.account.LedgerWriteException;
import kr.socialcredit.economy.domain.session.InvalidSessionStateException;
import kr.socialcredit.economy.domain.session.NotSessionOwnerException;
import kr.socialcredit.economy.domain.session.SelfInteractionException;
import kr.socialcredit.economy.domain.session.Session;
import kr.socialcredit.economy.domain.session.SessionNotFoundException;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;

/**
 * 진행 중인 세션 레지스트리
 *
 * [동시성]
 * - 세션 맵과 만료 타이머 맵은 EconomyStateLock 안에서만 읽고 쓴다
 * - 정산 경로는 락 안에서 세션 상태를 먼저 바꾼(또는 제거한) 뒤 크레딧을 움직인다
 *
 * [만료]
 * - 등록 시 만료 시각에 실행되는 작업을 TaskScheduler에 예약하고, 정상 종료 시 예약을 취소한다
 * - 타이머가 실행될 때 아직 활성 상태면 강제 만료하고 에스크로를 환불한다
 * - 주기적인 sweepExpired는 놓친 타이머를 보완한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRegistry {

    private final Map<String, Session> sessions = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> expiryTimers = new HashMap<>();

    private final EconomyStateLock stateLock;
    private final CreditLedgerUseCase creditLedger;
    private final TaskScheduler taskScheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 세션 등록 및 만료 예약
     */
    public <S extends Session> S register(S session) {
        stateLock.runWithLock("session:register", () -> {
            if (sessions.putIfAbsent(session.getId(), session) != null) {
                throw new IllegalStateException("중복된 세션 ID입니다: " + session.getId());
            }
            ScheduledFuture<?> timer = taskScheduler.schedule(
                    () -> expire(session.getId()), session.getExpiresAt());
            expiryTimers.put(session.getId(), timer);
        });
        log.info("[세션] 생성: id={}, kind={}, owner={}, expiresAt={}",
                session.getId(), session.kind(), session.getOwnerId(), session.getExpiresAt());
        return session;
    }

    public Optional<Session> find(String sessionId) {
        return stateLock.executeWithLock("session:find",
                () -> Optional.ofNullable(sessions.get(sessionId)));
    }

    /**
     * 활성 세션 조회
     *
     * @throws SessionNotFoundException 없거나, 종류가 다르거나, 이미 종료된 경우
     */
    public <S extends Session> S get(String sessionId, Class<S> type) {
        return stateLock.executeWithLock("session:get", () -> {
            Session session = sessions.get(sessionId);
            if (!type.isInstance(session) || !session.isActive()) {
                throw new SessionNotFoundException(sessionId);
            }
            return type.cast(session);
        });
    }

    /**
     * 두 번째 참가자의 수락
     * 세션 상태를 바꾼 뒤 반환하므로 같은 세션을 두 번 수락할 수 없다.
     */
    public <S extends Session> S claim(String sessionId, String claimantId, Class<S> type) {
        return stateLock.executeWithLock("session:claim", () -> {
            S session = get(sessionId, type);
            if (session.isOwnedBy(claimantId)) {
                throw new SelfInteractionException("자기 자신의 게임에는 참가할 수 없습니다");
            }
            if (!session.isClaimable()) {
                throw new InvalidSessionStateException(sessionId, "이미 진행 중인 게임입니다");
            }
            session.claim(claimantId);
            log.info("[세션] 수락: id={}, claimant={}", sessionId, claimantId);
            return session;
        });
    }

    /**
     * 소유자 전용 동작을 위한 조회
     */
    public <S extends Session> S requireOwned(String sessionId, String actorId, Class<S> type) {
        return stateLock.executeWithLock("session:owned", () -> {
            S session = get(sessionId, type);
            if (!session.isOwnedBy(actorId)) {
                throw new NotSessionOwnerException(sessionId, actorId);
            }
            return session;
        });
    }

    public <S extends Session> Optional<S> findActiveByOwner(String ownerId, Class<S> type, Predicate<S> filter) {
        return stateLock.executeWithLock("session:byOwner", () -> sessions.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .filter(s -> s.isOwnedBy(ownerId) && s.isActive())
                .filter(filter)
                .findFirst());
    }

    /**
     * 종료된 세션 제거. 이미 제거된 세션이면 아무 일도 하지 않는다.
     *
     * @return 이번 호출로 제거되었으면 true
     */
    public boolean resolve(String sessionId) {
        return stateLock.executeWithLock("session:resolve", () -> {
            Session removed = sessions.remove(sessionId);
            cancelTimer(sessionId);
            if (removed == null) {
                log.debug("[세션] 이미 처리된 세션 resolve 무시: id={}", sessionId);
                return false;
            }
            log.info("[세션] 종료: id={}, kind={}", sessionId, removed.kind());
            return true;
        });
    }

    /**
     * 강제 만료. 활성 상태일 때만 에스크로를 환불하고 제거한다.
     *
     * @return 이번 호출로 만료되었으면 true
     */
    public boolean expire(String sessionId) {
        Optional<SessionExpiredEvent> expired = stateLock.executeWithLock("session:expire", () -> {
            Session session = sessions.remove(sessionId);
            cancelTimer(sessionId);
            if (session == null || !session.isActive()) {
                return Optional.empty();
            }
            Map<String, Long> refunds = session.expire();
            refunds.forEach((userId, amount) -> refund(session, userId, amount));
            log.info("[세션] 만료: id={}, kind={}, refunds={}", sessionId, session.kind(), refunds);
            return Optional.of(new SessionExpiredEvent(sessionId, session.kind(), session.getOwnerId(),
                    session.getChannelId(), session.getMessageId(), refunds, clock.instant()));
        });
        expired.ifPresent(eventPublisher::publishEvent);
        return expired.isPresent();
    }

    /**
     * 만료 시각이 지난 세션 일괄 만료
     *
     * @return 만료 처리된 세션 수
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<String> overdue = stateLock.executeWithLock("session:sweep", () -> sessions.values().stream()
                .filter(session -> session.isExpiredAt(now))
                .map(Session::getId)
                .toList());
        int expired = 0;
        for (String sessionId : overdue) {
            if (expire(sessionId)) {
                expired++;
            }
        }
        return expired;
    }

    public void attachMessage(String sessionId, String messageId) {
        stateLock.runWithLock("session:attach", () -> {
            Session session = sessions.get(sessionId);
            if (session != null) {
                session.attachMessage(messageId);
            }
        });
    }

    public int activeCount() {
        return stateLock.executeWithLock("session:count", sessions::size);
    }

    public Instant now() {
        return clock.instant();
    }

    private void refund(Session session, String userId, long amount) {
        try {
            creditLedger.adjust(userId, amount, session.kind().getDisplayName() + " 만료 환불: " + session.getId());
        } catch (LedgerWriteException e) {
            // 원장 서비스가 이미 운영자 알림 이벤트를 발행함
            log.error("[세션] 만료 환불 실패: id={}, userId={}, amount={}", session.getId(), userId, amount, e);
        }
    }

    private void cancelTimer(String sessionId) {
        ScheduledFuture<?> timer = expiryTimers.remove(sessionId);
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
