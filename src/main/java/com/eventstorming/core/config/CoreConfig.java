package com.eventstorming.core.config;

import com.eventstorming.core.persistence.WorkshopJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source and JSON mapper shared by the store, the repositories and rendering.
 */
@Configuration
public class CoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper workshopObjectMapper() {
        return WorkshopJson.objectMapper();
    }
}
