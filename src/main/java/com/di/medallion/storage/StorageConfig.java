package com.di.medallion.storage;

import com.di.medallion.config.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers one {@link LayerStore} per staging layer under
 * {@code medallion.pipeline.data-dir}.
 */
@Configuration
public class StorageConfig {

    public static final String BRONZE = "bronze";
    public static final String SILVER = "silver";
    public static final String GOLD   = "gold";

    @Bean
    public LayerStore bronzeStore(PipelineProperties properties, Clock clock, CsvDatasetCodec codec) {
        return new LayerStore(BRONZE, properties.layerPath(BRONZE), clock, codec);
    }

    @Bean
    public LayerStore silverStore(PipelineProperties properties, Clock clock, CsvDatasetCodec codec) {
        return new LayerStore(SILVER, properties.layerPath(SILVER), clock, codec);
    }

    @Bean
    public LayerStore goldStore(PipelineProperties properties, Clock clock, CsvDatasetCodec codec) {
        return new LayerStore(GOLD, properties.layerPath(GOLD), clock, codec);
    }
}
