package kr.socialcredit.economy.application.port.out;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * 키-값 저장소 외부 포트
 * - 트랜잭션을 제공하지 않으며, 읽기-수정-쓰기의 원자성은 호출자 책임
 * - 모든 연산은 일시 장애 시 TransientStoreException을 던질 수 있다
 */
public interface KeyValueStorePort {

    Optional<String> get(String key);

    void set(String key, String value);

    void set(String key, String value, Duration ttl);

    /**
     * 원자적 증가. 키가 새로 생성된 경우에만 TTL을 건다.
     *
     * @return 증가 후 값
     */
    long increment(String key, Duration ttlOnCreate);

    boolean exists(String key);

    Set<String> keysByPrefix(String prefix);

    void delete(String key);
}
