package kr.socialcredit.economy.infrastructure.discord;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "discord")
public class DiscordProperties {

    private boolean enabled;

    @NotBlank
    private String token;

    /** 이 채널의 명령만 처리한다 */
    @NotBlank
    private String commandChannelId;
}
