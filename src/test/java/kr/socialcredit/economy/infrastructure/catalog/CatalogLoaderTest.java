package kr.socialcredit.economy.infrastructure.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.Rarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("카탈로그 로더 테스트")
class CatalogLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("아이템과 케이스를 읽고 등급 표기를 해석한다")
    void read() {
        String json = """
                {
                  "items": [
                    {"id": "a", "name": "A", "rarity": "Common", "collection": "one"},
                    {"id": "b", "name": "B", "rarity": "LEGENDARY", "collection": "one"}
                  ],
                  "containers": [
                    {"id": "box", "name": "Box", "collections": ["one"], "price": 30}
                  ]
                }
                """;

        Catalog catalog = CatalogLoader.read(
                new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)), objectMapper);

        assertThat(catalog.item("a").rarity()).isEqualTo(Rarity.COMMON);
        assertThat(catalog.item("b").rarity()).isEqualTo(Rarity.LEGENDARY);
        assertThat(catalog.container("box").price()).isEqualTo(30L);
        assertThat(catalog.poolFor(catalog.container("box"))).hasSize(2);
    }

    @Test
    @DisplayName("기본 카탈로그의 모든 케이스에는 아이템이 들어 있다")
    void bundledCatalog() {
        Catalog catalog = CatalogLoader.read(new ClassPathResource("catalog/catalog.json"), objectMapper);

        assertThat(catalog.containers()).isNotEmpty();
        assertThat(catalog.containers())
                .allSatisfy(container -> assertThat(catalog.poolFor(container)).isNotEmpty());
    }

    @Test
    @DisplayName("파일이 없거나 형식이 틀리면 시작할 수 없다")
    void invalid() {
        assertThatThrownBy(() -> CatalogLoader.read(new ClassPathResource("catalog/missing.json"), objectMapper))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> CatalogLoader.read(
                new ByteArrayResource("{\"items\": 1}".getBytes(StandardCharsets.UTF_8)), objectMapper))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("알 수 없는 등급은 거절")
    void unknownRarity() {
        String json = "{\"items\":[{\"id\":\"x\",\"rarity\":\"Mythic\",\"collection\":\"c\"}],\"containers\":[]}";

        assertThatThrownBy(() -> CatalogLoader.read(
                new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)), objectMapper))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
