package com.loglens.query;

import java.time.Instant;
import java.util.Objects;

/**
 * A time range resolved to concrete instants. A null bound is open.
 */
public final class TimeBounds {

    private final Instant earliest;
    private final Instant latest;

    public TimeBounds(Instant earliest, Instant latest) {
        this.earliest = earliest;
        this.latest = latest;
    }

    public Instant getEarliest() {
        return earliest;
    }

    public Instant getLatest() {
        return latest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeBounds)) return false;
        TimeBounds that = (TimeBounds) o;
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
