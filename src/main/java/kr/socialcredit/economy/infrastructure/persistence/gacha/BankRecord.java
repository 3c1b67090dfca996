package kr.socialcredit.economy.infrastructure.persistence.gacha;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import kr.socialcredit.economy.domain.gacha.ContainerBank;

import java.time.Instant;
import java.util.Map;

/**
 * bank:containers 키에 저장되는 은행 스냅샷
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BankRecord(Map<String, Integer> stock, Instant lastRefilled) {

    public static BankRecord from(ContainerBank bank) {
        return new BankRecord(bank.getStock(), bank.getLastRefilled());
    }

    public ContainerBank toDomain() {
        return ContainerBank.restore(stock == null ? Map.of() : stock, lastRefilled);
    }
}
