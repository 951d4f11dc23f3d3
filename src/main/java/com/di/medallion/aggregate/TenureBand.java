package com.di.medallion.aggregate;

/**
 * Years-of-service bands, left-closed and right-open. The first band starts at
 * -1 so a hire dated slightly after the reference date still lands in it.
 */
public enum TenureBand {

    UNDER_ONE(-1, 1, "0-1 years"),
    ONE_TO_THREE(1, 3, "1-3 years"),
    THREE_TO_FIVE(3, 5, "3-5 years"),
    FIVE_TO_TEN(5, 10, "5-10 years"),
    TEN_PLUS(10, 100, "10+ years");

    private final long   lowerInclusive;
    private final long   upperExclusive;
    private final String label;

    TenureBand(long lowerInclusive, long upperExclusive, String label) {
        this.lowerInclusive = lowerInclusive;
        this.upperExclusive = upperExclusive;
        this.label          = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean contains(long years) {
        return years >= lowerInclusive && years < upperExclusive;
    }

    /** Band containing {@code years}, or {@code null} for null or out-of-range values. */
    public static TenureBand fromYears(Long years) {
        if (years == null) {
            return null;
        }
        for (TenureBand band : values()) {
            if (band.contains(years)) {
                return band;
            }
        }
        return null;
    }
}
