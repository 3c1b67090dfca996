package kr.socialcredit.economy.infrastructure.config;

import kr.socialcredit.economy.application.port.out.KeyValueStorePort;
import kr.socialcredit.economy.domain.common.GameRandom;
import kr.socialcredit.economy.domain.gacha.RarityTable;
import kr.socialcredit.economy.infrastructure.persistence.RetryingKeyValueStore;
import kr.socialcredit.economy.infrastructure.persistence.redis.RedisKeyValueStoreAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

@Configuration
public class EconomyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public GameRandom gameRandom() {
        return bound -> ThreadLocalRandom.current().nextInt(bound);
    }

    @Bean
    public RarityTable rarityTable() {
        return RarityTable.standard();
    }

    /**
     * 모든 저장소 접근은 재시도 데코레이터를 거친다
     */
    @Bean
    @Primary
    public KeyValueStorePort keyValueStore(RedisKeyValueStoreAdapter redisAdapter, EconomyProperties properties) {
        EconomyProperties.Store store = properties.getStore();
        return new RetryingKeyValueStore(redisAdapter, store.getMaxAttempts(), store.getBackoff());
    }
}
