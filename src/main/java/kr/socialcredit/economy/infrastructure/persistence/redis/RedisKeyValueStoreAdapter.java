package kr.socialcredit.economy.infrastructure.persistence.redis;

import kr.socialcredit.economy.application.port.out.KeyValueStorePort;
import kr.socialcredit.economy.application.port.out.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis 기반 키-값 저장소 어댑터
 * - 값은 모두 문자열 (JSON 직렬화는 상위 어댑터 책임)
 * - Spring DataAccessException을 TransientStoreException으로 변환
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisKeyValueStoreAdapter implements KeyValueStorePort {

    // INCR과 최초 TTL 설정을 한 번에 실행
    private static final DefaultRedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>("""
            local value = redis.call('INCR', KEYS[1])
            if value == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return value
            """, Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        return execute("GET " + key, () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value) {
        execute("SET " + key, () -> {
            redisTemplate.opsForValue().set(key, value);
            return null;
        });
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        execute("SET " + key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        return execute("INCR " + key, () -> {
            Long value = redisTemplate.execute(
                    INCREMENT_SCRIPT,
                    List.of(key),
                    String.valueOf(ttlOnCreate.toMillis())
            );
            if (value == null) {
                throw new TransientStoreException("INCR 결과가 없습니다: " + key);
            }
            return value;
        });
    }

    @Override
    public boolean exists(String key) {
        return execute("EXISTS " + key, () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)));
    }

    @Override
    public Set<String> keysByPrefix(String prefix) {
        return execute("KEYS " + prefix + "*", () -> {
            Set<String> keys = redisTemplate.keys(prefix + "*");
            return keys == null ? Set.of() : keys;
        });
    }

    @Override
    public void delete(String key) {
        execute("DEL " + key, () -> redisTemplate.delete(key));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.debug("Redis 연산 실패: {} - {}", operation, e.getMessage());
            throw new TransientStoreException("Redis 연산 실패: " + operation, e);
        }
    }
}
