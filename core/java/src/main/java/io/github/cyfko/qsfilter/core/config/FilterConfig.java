package io.github.cyfko.qsfilter.core.config;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable settings shared by the value converter and the query applier.
 *
 * <pre>{@code
 * FilterConfig config = FilterConfig.builder()
 *     .maxLimit(500)
 *     .zoneId(ZoneId.of("Europe/Berlin"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterConfig {

    /** Result-size ceiling applied when nothing else is configured. */
    public static final int DEFAULT_MAX_LIMIT = 10000;

    private static final FilterConfig DEFAULTS = builder().build();

    private final int maxLimit;
    private final ZoneId zoneId;

    private FilterConfig(Builder builder) {
        this.maxLimit = builder.maxLimit;
        this.zoneId = builder.zoneId;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * @return the configuration with a {@value #DEFAULT_MAX_LIMIT} row ceiling and the system zone
     */
    public static FilterConfig defaults() { return DEFAULTS; }

    /**
     * Maximum number of rows a query may return. Used as the limit when the request gives
     * none, and as the upper bound when it does.
     */
    public int getMaxLimit() { return maxLimit; }

    /** Zone used to adapt parsed date-times to instant-based and zoned column types. */
    public ZoneId getZoneId() { return zoneId; }

    @Override
    public String toString() {
        return String.format("FilterConfig{maxLimit=%d, zoneId=%s}", maxLimit, zoneId);
    }

    public static final class Builder {
        private int maxLimit = DEFAULT_MAX_LIMIT;
        private ZoneId zoneId = ZoneId.systemDefault();

        public Builder maxLimit(int maxLimit) {
            if (maxLimit <= 0) {
                throw new IllegalArgumentException("maxLimit must be positive. Provided: " + maxLimit);
            }
            this.maxLimit = maxLimit;
            return this;
        }

        public Builder zoneId(ZoneId zoneId) {
            this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
            return this;
        }

        public FilterConfig build() { return new FilterConfig(this); }
    }
}
