package com.di.medallion.pipeline;

import com.di.medallion.exception.ErrorCategory;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A fatal error caught at a phase boundary.
 *
 * @param phase    phase name ({@code Connection} for the pre-flight check)
 * @param message  error message as thrown
 * @param category classification of the error
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PhaseError(String phase, String message, ErrorCategory category) {

    @Override
    public String toString() {
        return phase + ": " + message;
    }
}
