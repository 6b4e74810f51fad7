package com.techStack.courseHub.config.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(UserProfileProperties.class)
public class AppConfig {

    /**
     * UTC clock shared by token issuing and verification
     */
    @Bean
    public Clock clock() {
        Clock systemClock = Clock.systemUTC();
        log.info("System Clock initialized at {}", systemClock.instant());
        return systemClock;
    }
}
