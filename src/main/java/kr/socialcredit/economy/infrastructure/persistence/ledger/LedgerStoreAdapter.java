package kr.socialcredit.economy.infrastructure.persistence.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.socialcredit.economy.application.port.out.KeyValueStorePort;
import kr.socialcredit.economy.application.port.out.LedgerStorePort;
import kr.socialcredit.economy.domain.account.Account;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 계정 원장 저장소 어댑터
 * - 키: user:{userId}
 * - 값: LedgerRecord JSON
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerStoreAdapter implements LedgerStorePort {

    static final String KEY_PREFIX = "user:";

    private final KeyValueStorePort keyValueStore;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Account> findById(String userId) {
        return keyValueStore.get(KEY_PREFIX + userId)
                .map(json -> deserialize(userId, json));
    }

    @Override
    public List<Account> findAll() {
        List<Account> accounts = new ArrayList<>();
        for (String key : keyValueStore.keysByPrefix(KEY_PREFIX)) {
            String userId = key.substring(KEY_PREFIX.length());
            try {
                findById(userId).ifPresent(accounts::add);
            } catch (IllegalStateException e) {
                log.warn("손상된 원장 레코드 건너뜀: key={}", key);
            }
        }
        return accounts;
    }

    @Override
    public void save(Account account) {
        keyValueStore.set(KEY_PREFIX + account.getId(), serialize(LedgerRecord.from(account)));
    }

    private Account deserialize(String userId, String json) {
        try {
            LedgerRecord record = objectMapper.readValue(json, LedgerRecord.class);
            // 예전 레코드에는 id가 없을 수 있음
            if (record.id() == null) {
                record = record.withId(userId);
            }
            return record.toDomain();
        } catch (JsonProcessingException e) {
            log.error("원장 레코드 역직렬화 실패: userId={}", userId, e);
            throw new IllegalStateException("손상된 원장 레코드입니다: " + userId, e);
        }
    }

    private String serialize(LedgerRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("원장 레코드 직렬화 실패: " + record.id(), e);
        }
    }
}
