package kr.socialcredit.economy.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * economy.* 설정
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "economy")
public class EconomyProperties {

    /**
     * 관리자 목록 파일 경로 ({"admin_ids": [...]}), 비어 있으면 관리자 없음
     */
    private String adminFile;

    @Valid
    private Store store = new Store();
    @Valid
    private Lock lock = new Lock();
    @Valid
    private Session session = new Session();
    @Valid
    private Casino casino = new Casino();
    @Valid
    private Gacha gacha = new Gacha();
    @Valid
    private Pricing pricing = new Pricing();
    @Valid
    private Audit audit = new Audit();
    @Valid
    private Voice voice = new Voice();

    @Getter
    @Setter
    public static class Store {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration backoff = Duration.ofMillis(100);
    }

    @Getter
    @Setter
    public static class Lock {
        @NotNull
        private Duration waitTimeout = Duration.ofSeconds(5);
        @Min(1)
        private int retryCount = 3;
    }

    @Getter
    @Setter
    public static class Session {
        @NotNull
        private Duration duelTtl = Duration.ofMinutes(15);
        @NotNull
        private Duration casinoTtl = Duration.ofMinutes(15);
        @NotNull
        private Duration blackjackTtl = Duration.ofMinutes(15);
        @NotNull
        private Duration saleTtl = Duration.ofMinutes(5);
        @Min(1000)
        private long sweepIntervalMs = 30000;
    }

    @Getter
    @Setter
    public static class Casino {
        @Min(0)
        private int revealFrames = 5;
        @NotNull
        private Duration revealDelay = Duration.ofMillis(500);
    }

    @Getter
    @Setter
    public static class Gacha {
        @Min(1)
        private int dailyOpenLimit = 5;
        @Min(1)
        private int dailyPurchaseLimit = 5;
        @Min(1)
        private int drawsPerContainer = 3;
        @Min(0)
        private int bankRefillQuantity = 10;
        @NotNull
        private Duration bankRefillInterval = Duration.ofHours(12);
        @NotBlank
        private String catalogLocation = "classpath:catalog/catalog.json";
    }

    @Getter
    @Setter
    public static class Pricing {
        private boolean feedEnabled = false;
        private String feedUrl = "https://api.coingecko.com/api/v3/simple/price?ids=bitcoin&vs_currencies=usd";
        @Min(1000)
        private long recomputeIntervalMs = 900000;
        @NotNull
        private Duration sampleWindow = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Audit {
        private boolean kafkaEnabled = false;
        @NotBlank
        private String topic = "credit-audit";
        private String logChannelId;
    }

    @Getter
    @Setter
    public static class Voice {
        @Min(1)
        private long secondsPerCredit = 60;
        @Min(1000)
        private long settleIntervalMs = 60000;
    }
}
