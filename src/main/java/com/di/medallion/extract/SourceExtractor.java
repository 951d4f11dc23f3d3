package com.di.medallion.extract;

import com.di.medallion.dataset.Dataset;
import com.di.medallion.exception.ExtractionException;

/**
 * Reads one entity from the source system.
 *
 * <p>Implementations return either the complete dataset, with exactly the
 * columns declared by {@link SourceEntity#getColumns()} in that order, or throw.
 */
public interface SourceExtractor {

    /**
     * @throws ExtractionException if the entity cannot be read in full
     */
    Dataset extract(SourceEntity entity);
}
