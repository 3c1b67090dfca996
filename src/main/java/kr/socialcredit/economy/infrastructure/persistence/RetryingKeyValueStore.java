package kr.socialcredit.economy.infrastructure.persistence;

import kr.socialcredit.economy.application.port.out.KeyValueStorePort;
import kr.socialcredit.economy.application.port.out.TransientStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 재시도 데코레이터
 * TransientStoreException에 한해 고정 간격으로 최대 maxAttempts번 시도하고,
 * 모두 실패하면 마지막 예외를 그대로 던진다.
 * increment는 멱등이 아니므로 재시도하지 않는다.
 */
@Slf4j
public class RetryingKeyValueStore implements KeyValueStorePort {

    private final KeyValueStorePort delegate;
    private final int maxAttempts;
    private final Duration backoff;

    public RetryingKeyValueStore(KeyValueStorePort delegate, int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("최대 시도 횟수는 1 이상이어야 합니다");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @Override
    public Optional<String> get(String key) {
        return withRetry("get " + key, () -> delegate.get(key));
    }

    @Override
    public void set(String key, String value) {
        withRetry("set " + key, () -> {
            delegate.set(key, value);
            return null;
        });
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        withRetry("set " + key, () -> {
            delegate.set(key, value, ttl);
            return null;
        });
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        return delegate.increment(key, ttlOnCreate);
    }

    @Override
    public boolean exists(String key) {
        return withRetry("exists " + key, () -> delegate.exists(key));
    }

    @Override
    public Set<String> keysByPrefix(String prefix) {
        return withRetry("keys " + prefix, () -> delegate.keysByPrefix(prefix));
    }

    @Override
    public void delete(String key) {
        withRetry("delete " + key, () -> {
            delegate.delete(key);
            return null;
        });
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        TransientStoreException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransientStoreException e) {
                last = e;
                log.warn("저장소 연산 실패, 재시도 {}/{}: {} - {}", attempt, maxAttempts, operation, e.getMessage());
                if (attempt < maxAttempts) {
                    sleep();
                }
            }
        }
        throw last;
    }

    private void sleep() {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("재시도 대기 중 인터럽트 발생", e);
        }
    }
}
