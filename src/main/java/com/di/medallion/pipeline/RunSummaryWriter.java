package com.di.medallion.pipeline;

import com.di.medallion.config.PipelineProperties;
import com.di.medallion.exception.StorageException;
import com.di.medallion.storage.LayerStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Serialises a {@link RunSummary} to JSON under the data directory, as
 * {@code run_summary_{yyyyMMdd_HHmmss}.json} and {@code run_summary_latest.json}.
 */
@Slf4j
@Component
public class RunSummaryWriter {

    private final Path         directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public RunSummaryWriter(PipelineProperties properties) {
        this(properties.getDataPath());
    }

    public RunSummaryWriter(Path directory) {
        this.directory    = directory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return path of the timestamped summary
     * @throws StorageException if either file cannot be written
     */
    public Path write(RunSummary summary) {
        String timestamp = summary.getStartTime().format(LayerStore.FILE_TIMESTAMP);
        Path timestamped = directory.resolve("run_summary_" + timestamp + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(timestamped.toFile(), summary);
            Files.copy(timestamped, directory.resolve("run_summary_latest.json"), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to write run summary to " + timestamped, e);
        }
        log.info("[SUMMARY] written → {}", timestamped);
        return timestamped;
    }
}
