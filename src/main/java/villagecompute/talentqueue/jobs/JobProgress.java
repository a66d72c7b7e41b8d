package villagecompute.talentqueue.jobs;

/**
 * Callback handed to a {@link JobHandler} for reporting how far along the current attempt is.
 *
 * <p>
 * Progress is visible through the status API. Reporting is best effort: a failed update is logged and never fails the
 * job.
 */
@FunctionalInterface
public interface JobProgress {

    JobProgress NONE = percent -> {
    };

    /**
     * Reports progress of the running attempt.
     *
     * @param percent
     *            0-100; values outside the range are clamped
     */
    void report(int percent);
}
