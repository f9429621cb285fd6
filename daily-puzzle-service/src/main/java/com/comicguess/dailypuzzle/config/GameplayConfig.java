package com.comicguess.dailypuzzle.config;

import com.comicguess.dailypuzzle.ratelimit.RateLimitProperties;
import com.comicguess.dailypuzzle.service.CharacterPoolCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class GameplayConfig {

    /**
     * Puzzle days roll over at midnight UTC
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CharacterPoolCatalog characterPoolCatalog(
            @Value("${puzzle.pool-location:classpath:character-pools.json}") Resource poolLocation) {
        try (InputStream in = poolLocation.getInputStream()) {
            return CharacterPoolCatalog.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read character pools from " + poolLocation, e);
        }
    }
}
