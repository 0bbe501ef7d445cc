package com.loglens.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Represents a time range for query filtering, as written by the user:
 * {@code now}, relative offsets such as {@code -24h} or {@code -7d@d},
 * ISO-8601 timestamps or epoch seconds. Either bound may be absent.
 */
public class TimeRange {

    @JsonProperty("earliest")
    private final String earliest;

    @JsonProperty("latest")
    private final String latest;

    @JsonCreator
    public TimeRange(@JsonProperty("earliest") String earliest, @JsonProperty("latest") String latest) {
        this.earliest = earliest;
        this.latest = latest;
    }

    public static TimeRange unbounded() {
        return new TimeRange(null, null);
    }

    public String getEarliest() {
        return earliest;
    }

    public String getLatest() {
        return latest;
    }

    public boolean isUnbounded() {
        return isBlank(earliest) && isBlank(latest);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange that = (TimeRange) o;
        return Objects.equals(earliest, that.earliest) && Objects.equals(latest, that.latest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(earliest, latest);
    }

    @Override
    public String toString() {
        return "[" + earliest + ", " + latest + "]";
    }
}
