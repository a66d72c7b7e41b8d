package villagecompute.talentqueue.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health verdict of the job system.
 */
public enum HealthStatus {

    /** Stats readable and broker answers its ping. */
    HEALTHY("healthy"),

    /** Stats readable but the broker ping failed. */
    DEGRADED("degraded"),

    /** Stats could not be read. */
    UNHEALTHY("unhealthy");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
