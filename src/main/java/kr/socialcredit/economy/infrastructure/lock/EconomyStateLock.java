package kr.socialcredit.economy.infrastructure.lock;

import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 경제 상태 전체를 보호하는 단일 프로세스 락
 * - 잔액, 세션 레지스트리, 인벤토리, 은행 변경은 모두 이 락 안에서 수행
 * - 재진입 가능: 서비스가 잡은 락 안에서 원장 변경을 다시 호출해도 된다
 * - 공정 모드: 오래 기다린 요청이 먼저 획득
 */
@Slf4j
@Component
public class EconomyStateLock {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration waitTimeout;
    private final int retryCount;

    @Autowired
    public EconomyStateLock(EconomyProperties properties) {
        this(properties.getLock().getWaitTimeout(), properties.getLock().getRetryCount());
    }

    public EconomyStateLock(Duration waitTimeout, int retryCount) {
        this.waitTimeout = waitTimeout;
        this.retryCount = retryCount;
    }

    /**
     * 락을 획득하고 작업을 실행
     *
     * @param purpose 로그용 작업 이름
     * @param action 실행할 작업
     * @return 작업 결과
     */
    public <T> T executeWithLock(String purpose, Supplier<T> action) {
        int attempts = 0;

        while (attempts < retryCount) {
            if (tryLock()) {
                try {
                    return action.get();
                } finally {
                    lock.unlock();
                }
            }

            attempts++;
            log.warn("락 획득 실패, 재시도 {}/{}: purpose={}", attempts, retryCount, purpose);
        }

        throw LockAcquisitionException.of(purpose, retryCount);
    }

    public void runWithLock(String purpose, Runnable action) {
        executeWithLock(purpose, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    private boolean tryLock() {
        try {
            return lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 대기 중 인터럽트 발생", e);
        }
    }
}
