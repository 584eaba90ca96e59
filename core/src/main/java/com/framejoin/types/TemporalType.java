package com.framejoin.types;

import java.util.Objects;

/**
 * Data type representing a point in time (datetime) or a duration (timedelta).
 *
 * <p>Values are stored as a count of {@link Resolution} units; datetimes count
 * from the Unix epoch (1970-01-01 00:00:00 UTC).
 */
public final class TemporalType implements DataType {

    /**
     * Whether values are instants or durations.
     */
    public enum Kind {
        DATETIME("datetime64"),
        TIMEDELTA("timedelta64");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }
    }

    /**
     * Resolution of the stored unit count, coarsest first.
     */
    public enum Resolution {
        SECONDS("s", 1L),
        MILLISECONDS("ms", 1_000L),
        MICROSECONDS("us", 1_000_000L),
        NANOSECONDS("ns", 1_000_000_000L);

        private final String unit;
        private final long perSecond;

        Resolution(String unit, long perSecond) {
            this.unit = unit;
            this.perSecond = perSecond;
        }

        public String unit() {
            return unit;
        }

        /**
         * Returns the number of units in one second.
         */
        public long perSecond() {
            return perSecond;
        }

        /**
         * Returns true if this resolution can represent every value of {@code other}.
         */
        public boolean isAtLeastAsFineAs(Resolution other) {
            return perSecond >= other.perSecond;
        }
    }

    private final Kind kind;
    private final Resolution resolution;

    private TemporalType(Kind kind, Resolution resolution) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.resolution = Objects.requireNonNull(resolution, "resolution must not be null");
    }

    public static TemporalType datetime(Resolution resolution) {
        return new TemporalType(Kind.DATETIME, resolution);
    }

    public static TemporalType timedelta(Resolution resolution) {
        return new TemporalType(Kind.TIMEDELTA, resolution);
    }

    public Kind kind() {
        return kind;
    }

    public Resolution resolution() {
        return resolution;
    }

    /**
     * Returns the same kind of temporal type with another resolution.
     */
    public TemporalType withResolution(Resolution other) {
        return new TemporalType(kind, other);
    }

    @Override
    public String typeName() {
        return kind.prefix + "[" + resolution.unit() + "]";
    }

    @Override
    public int defaultSize() {
        return 8; // 64-bit unit count
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TemporalType)) return false;
        TemporalType that = (TemporalType) obj;
        return kind == that.kind && resolution == that.resolution;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, resolution);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
