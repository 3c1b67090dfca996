package kr.socialcredit.economy.infrastructure.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import kr.socialcredit.economy.application.port.out.PriceFeedPort;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * HTTP 시세 피드 어댑터
 * 응답 형식: {"bitcoin": {"usd": 67000.0}}
 * 실패하면 경고만 남기고 empty를 돌려준다.
 */
@Slf4j
@Component
public class HttpPriceFeedAdapter implements PriceFeedPort {

    private final RestTemplate restTemplate;
    private final EconomyProperties.Pricing pricing;

    public HttpPriceFeedAdapter(RestTemplateBuilder builder, EconomyProperties properties) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(3))
                .setReadTimeout(Duration.ofSeconds(5))
                .build();
        this.pricing = properties.getPricing();
    }

    @Override
    public OptionalDouble fetchCurrentPrice() {
        if (!pricing.isFeedEnabled()) {
            return OptionalDouble.empty();
        }
        try {
            JsonNode body = restTemplate.getForObject(pricing.getFeedUrl(), JsonNode.class);
            return extractPrice(body);
        } catch (RestClientException e) {
            log.warn("[시세] 시세 조회 실패: url={}, error={}", pricing.getFeedUrl(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    static OptionalDouble extractPrice(JsonNode body) {
        if (body == null || !body.isObject() || body.isEmpty()) {
            return OptionalDouble.empty();
        }
        JsonNode asset = body.elements().next();
        if (asset == null || !asset.isObject() || asset.isEmpty()) {
            return OptionalDouble.empty();
        }
        JsonNode quote = asset.elements().next();
        if (!quote.isNumber() || quote.asDouble() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(quote.asDouble());
    }
}
