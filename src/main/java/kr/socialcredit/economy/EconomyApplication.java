package kr.socialcredit.economy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan(basePackages = "kr.socialcredit.economy.infrastructure.config")
public class EconomyApplication {

    public static void main(String[] args) {
        SpringApplication.run(EconomyApplication.class, args);
    }
}
