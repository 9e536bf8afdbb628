package com.skypulse.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Locale;
import java.util.Objects;

/**
 * Ordered (origin, destination) city pair.
 *
 * Used as the key of every per-route structure (price history, alerts, locks,
 * recommendation cache). Equality ignores case and surrounding whitespace so
 * "NYC → Paris" and "nyc → paris " address the same history.
 */
@Getter
public final class Route {

    private final String origin;
    private final String destination;

    @JsonCreator
    public Route(@JsonProperty("origin") String origin,
            @JsonProperty("destination") String destination) {
        this.origin = origin == null ? null : origin.trim();
        this.destination = destination == null ? null : destination.trim();
    }

    public static Route of(String origin, String destination) {
        return new Route(origin, destination);
    }

    /**
     * Stable string key used for the Redis recommendation cache.
     */
    @JsonIgnore
    public String getCacheKey() {
        return normalize(origin) + "|" + normalize(destination);
    }

    @JsonIgnore
    public boolean isComplete() {
        return origin != null && !origin.isEmpty() && destination != null && !destination.isEmpty();
    }

    private static String normalize(String city) {
        return city == null ? "" : city.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Route)) {
            return false;
        }
        Route other = (Route) o;
        return normalize(origin).equals(normalize(other.origin))
                && normalize(destination).equals(normalize(other.destination));
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalize(origin), normalize(destination));
    }

    @Override
    public String toString() {
        return origin + " → " + destination;
    }
}
