package kr.socialcredit.economy.infrastructure.discord;

import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.cache.CacheFlag;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * discord.enabled=true 일 때만 게이트웨이에 접속한다
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "discord.enabled", havingValue = "true")
@EnableConfigurationProperties(DiscordProperties.class)
public class DiscordConfig {

    @Bean(destroyMethod = "shutdown")
    public JDA jda(DiscordProperties properties) throws InterruptedException {
        JDA jda = JDABuilder.createDefault(properties.getToken())
                .enableIntents(GatewayIntent.GUILD_MESSAGES, GatewayIntent.MESSAGE_CONTENT,
                        GatewayIntent.GUILD_VOICE_STATES)
                .enableCache(CacheFlag.VOICE_STATE)
                .build();
        jda.awaitReady();
        log.info("[디스코드] 게이트웨이 연결 완료: user={}", jda.getSelfUser().getName());
        return jda;
    }
}
