package com.di.medallion.exception;

import java.nio.file.Path;

/** A stage's required upstream {@code *_latest} file does not exist. */
public class LayerFileNotFoundException extends PipelineException {

    private final Path path;

    public LayerFileNotFoundException(String layer, Path path) {
        super(capitalize(layer) + " file not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    private static String capitalize(String s) {
        return s == null || s.isEmpty() ? "Layer" : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
