package com.autodev.coordinator.config;

import com.autodev.coordinator.memory.HttpMemorySink;
import com.autodev.coordinator.memory.LoggingMemorySink;
import com.autodev.coordinator.memory.MemorySink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoordinatorConfig {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorConfig.class);

    /** Single time source for the service layer; tests pass a fixed clock instead. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MemorySink memorySink(CoordinatorProperties props, ObjectMapper objectMapper) {
        CoordinatorProperties.Memory cfg = props.getMemory();
        if (!cfg.isEnabled()) {
            log.info("autodev.memory.base-url not set, long-term memory hand-off disabled");
            return new LoggingMemorySink();
        }
        log.info("Long-term memory hand-off to {}", cfg.getBaseUrl());
        return new HttpMemorySink(cfg.getBaseUrl(), cfg.getTimeout(), objectMapper);
    }
}
