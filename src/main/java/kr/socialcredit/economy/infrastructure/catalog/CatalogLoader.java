package kr.socialcredit.economy.infrastructure.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.Item;
import kr.socialcredit.economy.domain.gacha.LootContainer;
import kr.socialcredit.economy.domain.gacha.Rarity;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * 아이템/케이스 카탈로그 로딩
 * 카탈로그는 시작 시 한 번 읽고 이후 변경하지 않는다.
 */
@Slf4j
@Configuration
public class CatalogLoader {

    record CatalogFile(List<ItemEntry> items, List<ContainerEntry> containers) {}

    record ItemEntry(String id, String name, String rarity, String collection) {}

    record ContainerEntry(String id, String name, Set<String> collections, long price) {}

    @Bean
    public Catalog catalog(ResourceLoader resourceLoader, ObjectMapper objectMapper, EconomyProperties properties) {
        String location = properties.getGacha().getCatalogLocation();
        Catalog catalog = read(resourceLoader.getResource(location), objectMapper);
        log.info("[카탈로그] 로드 완료: location={}, items={}, containers={}",
                location, catalog.items().size(), catalog.containers().size());
        return catalog;
    }

    static Catalog read(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            throw new IllegalStateException("카탈로그 파일이 없습니다: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            CatalogFile file = objectMapper.readValue(in, CatalogFile.class);
            List<Item> items = file.items() == null ? List.of() : file.items().stream()
                    .map(e -> new Item(e.id(), e.name(), Rarity.fromLabel(e.rarity()), e.collection()))
                    .toList();
            List<LootContainer> containers = file.containers() == null ? List.of() : file.containers().stream()
                    .map(e -> new LootContainer(e.id(), e.name(), e.collections(), e.price()))
                    .toList();
            return new Catalog(items, containers);
        } catch (IOException e) {
            throw new IllegalStateException("카탈로그 파일을 읽을 수 없습니다: " + resource.getDescription(), e);
        }
    }
}
