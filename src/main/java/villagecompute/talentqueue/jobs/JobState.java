package villagecompute.talentqueue.jobs;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job lifecycle states.
 *
 * <pre>
 *   enqueue ──► WAITING ──claim──► ACTIVE ──success──► COMPLETED
 *      │           ▲                 │  │
 *      │ (delay)   │ (due)           │  └──terminal failure / stall limit──► FAILED
 *      └──────► DELAYED ◄──retry─────┘
 * </pre>
 *
 * The stall detector may also move an ACTIVE job straight back to WAITING.
 */
public enum JobState {

    WAITING("waiting"),

    ACTIVE("active"),

    COMPLETED("completed"),

    FAILED("failed"),

    DELAYED("delayed");

    private final String label;

    JobState(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<JobState> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (JobState state : values()) {
            if (state.label.equalsIgnoreCase(label.trim())) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
