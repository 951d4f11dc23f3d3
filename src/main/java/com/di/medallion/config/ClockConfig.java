package com.di.medallion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The single wall-clock source. Stages capture a reference instant from it once
 * per phase; tests replace it with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock pipelineClock(PipelineProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
