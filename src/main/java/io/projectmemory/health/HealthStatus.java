package io.projectmemory.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Overall service state, ordered from best to worst. */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /** The worse of the two states. */
    public HealthStatus worse(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
