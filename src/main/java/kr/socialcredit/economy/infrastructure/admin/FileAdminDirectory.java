package kr.socialcredit.economy.infrastructure.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.socialcredit.economy.application.port.out.AdminDirectoryPort;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 관리자 목록 파일 어댑터
 * 파일 형식: {"admin_ids": ["123", "456"]}
 * 시작 시 한 번 읽는다. 파일이 없으면 관리자 없이 동작한다.
 */
@Slf4j
@Component
public class FileAdminDirectory implements AdminDirectoryPort {

    record AdminFile(@JsonProperty("admin_ids") List<String> adminIds) {}

    private final Set<String> adminIds;

    public FileAdminDirectory(EconomyProperties properties, ObjectMapper objectMapper) {
        this.adminIds = load(properties.getAdminFile(), objectMapper);
        log.info("[관리자] 관리자 {}명 로드", adminIds.size());
    }

    @Override
    public boolean isAdmin(String userId) {
        return userId != null && adminIds.contains(userId);
    }

    @Override
    public Set<String> adminIds() {
        return adminIds;
    }

    private static Set<String> load(String location, ObjectMapper objectMapper) {
        if (location == null || location.isBlank()) {
            log.warn("[관리자] 관리자 파일 경로가 설정되지 않았습니다. 관리자 명령이 비활성화됩니다");
            return Set.of();
        }
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            log.warn("[관리자] 관리자 파일이 없습니다: {}. 관리자 명령이 비활성화됩니다", path.toAbsolutePath());
            return Set.of();
        }
        try {
            AdminFile file = objectMapper.readValue(path.toFile(), AdminFile.class);
            if (file.adminIds() == null) {
                return Set.of();
            }
            return Collections.unmodifiableSet(file.adminIds().stream()
                    .filter(id -> id != null && !id.isBlank())
                    .map(String::trim)
                    .collect(Collectors.toSet()));
        } catch (IOException e) {
            throw new IllegalStateException("관리자 파일을 읽을 수 없습니다: " + path, e);
        }
    }
}
