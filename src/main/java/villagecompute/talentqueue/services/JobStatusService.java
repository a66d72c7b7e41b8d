package villagecompute.talentqueue.services;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.api.types.JobStatusType;
import villagecompute.talentqueue.broker.QueueBroker;
import villagecompute.talentqueue.jobs.JobPayloadCodec;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.JobRecord;
import villagecompute.talentqueue.jobs.JobState;

/**
 * Reads job status straight from the broker; nothing is cached.
 */
@ApplicationScoped
public class JobStatusService {

    @Inject
    QueueBroker broker;

    @Inject
    JobPayloadCodec codec;

    /**
     * Looks up a job in a queue. Unknown ids, evicted jobs and jobs of another queue are all empty.
     *
     * @param jobId
     *            job id as handed to the producer
     * @param queue
     *            queue the caller expects the job in
     */
    public Optional<JobStatusType> getStatus(String jobId, JobQueue queue) {
        Optional<Long> id = parseId(jobId);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return broker.getJob(id.get()).filter(job -> job.queue() == queue).map(this::toStatus);
    }

    /**
     * Lists jobs of a queue in one state, at most {@code limit}.
     */
    public List<JobStatusType> listJobs(JobQueue queue, JobState state, int limit) {
        return broker.listByState(queue, state, limit).stream().map(this::toStatus).toList();
    }

    JobStatusType toStatus(JobRecord job) {
        String error = job.state() == JobState.FAILED || job.state() == JobState.DELAYED ? job.failureReason() : null;
        return new JobStatusType(String.valueOf(job.id()), job.queue().getName(), job.state(), job.progress(),
                job.priority(), job.attempts(), job.maxAttempts(), codec.decodeResult(job.result()), error,
                job.enqueuedAt(), job.scheduledAt(), job.startedAt(), job.finishedAt());
    }

    private static Optional<Long> parseId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(jobId.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
