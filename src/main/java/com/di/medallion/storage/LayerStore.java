package com.di.medallion.storage;

import com.di.medallion.dataset.Dataset;
import com.di.medallion.exception.LayerFileNotFoundException;
import com.di.medallion.exception.StorageException;
import com.di.medallion.quality.QualityReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One durable staging layer (bronze, silver or gold) backed by a directory.
 *
 * <p>Every materialisation is written twice:
 * <ul>
 *   <li>{@code {stem}_{yyyyMMdd_HHmmss}.csv}: immutable audit copy.</li>
 *   <li>{@code {stem}_latest.csv}: overwritten pointer to the newest version.</li>
 * </ul>
 * When a quality report is supplied it is written alongside as
 * {@code {stem}_{timestamp}.quality.json} and {@code {stem}_latest.quality.json}.
 *
 * <p>Downstream stages read only the {@code latest} pointer.
 */
@Slf4j
public class LayerStore {

    public static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final String LATEST = "latest";

    private final String          layer;
    private final Path            directory;
    private final Clock           clock;
    private final CsvDatasetCodec codec;
    private final ObjectMapper    objectMapper;

    public LayerStore(String layer, Path directory, Clock clock, CsvDatasetCodec codec) {
        this.layer        = layer;
        this.directory    = directory;
        this.clock        = clock;
        this.codec        = codec;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Writes {@code dataset} as a timestamped file and refreshes the latest pointer.
     *
     * @return path of the timestamped file
     * @throws StorageException if either file cannot be written
     */
    public Path write(String stem, Dataset dataset, QualityReport report) {
        String timestamp = LocalDateTime.now(clock).format(FILE_TIMESTAMP);
        Path timestamped = directory.resolve(stem + "_" + timestamp + ".csv");
        Path latest      = latestPath(stem);
        try {
            Files.createDirectories(directory);
            try (BufferedWriter out = Files.newBufferedWriter(timestamped, StandardCharsets.UTF_8)) {
                codec.write(dataset, out);
            }
            replace(timestamped, latest);

            if (report != null) {
                Path reportPath = directory.resolve(stem + "_" + timestamp + ".quality.json");
                objectMapper.writeValue(reportPath.toFile(), report);
                replace(reportPath, directory.resolve(stem + "_" + LATEST + ".quality.json"));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to save " + stem + " to " + layer + " layer: " + timestamped, e);
        }

        log.info("[STORE] Saved {} rows to {} layer: {}", dataset.getRowCount(), layer, timestamped);
        log.info("[STORE] Saved latest version: {}", latest);
        return timestamped;
    }

    /**
     * @throws LayerFileNotFoundException if no latest file exists for {@code stem}
     * @throws StorageException if the file exists but cannot be read
     */
    public Dataset readLatest(String stem) {
        Path latest = latestPath(stem);
        if (!Files.exists(latest)) {
            throw new LayerFileNotFoundException(layer, latest);
        }
        try (BufferedReader in = Files.newBufferedReader(latest, StandardCharsets.UTF_8)) {
            Dataset dataset = codec.read(in);
            log.info("[STORE] Loaded {} rows from {} layer", dataset.getRowCount(), layer);
            return dataset;
        } catch (IOException e) {
            throw new StorageException("Failed to load from " + layer + " layer: " + latest, e);
        }
    }

    public Path latestPath(String stem) {
        return directory.resolve(stem + "_" + LATEST + ".csv");
    }

    public boolean hasLatest(String stem) {
        return Files.exists(latestPath(stem));
    }

    /** Copies {@code source} over {@code target} through a temp file so readers never see a partial file. */
    private void replace(Path source, Path target) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[STORE] Atomic move not supported for {}; replacing in place", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
