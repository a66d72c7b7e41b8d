package villagecompute.talentqueue.testing;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import villagecompute.talentqueue.jobs.JobHandler;
import villagecompute.talentqueue.jobs.JobProgress;
import villagecompute.talentqueue.jobs.JobQueue;
import villagecompute.talentqueue.jobs.payload.AiProcessingPayload;

/**
 * AI queue handler whose behavior is supplied by the test.
 */
public class ScriptedAiHandler implements JobHandler<AiProcessingPayload> {

    @FunctionalInterface
    public interface Script {
        Map<String, Object> run(int call, AiProcessingPayload payload, JobProgress progress) throws Exception;
    }

    private final Script script;
    private final AtomicInteger calls = new AtomicInteger();

    public ScriptedAiHandler(Script script) {
        this.script = script;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public JobQueue handlesQueue() {
        return JobQueue.AI;
    }

    @Override
    public Class<AiProcessingPayload> payloadType() {
        return AiProcessingPayload.class;
    }

    @Override
    public Map<String, Object> execute(Long jobId, AiProcessingPayload payload, JobProgress progress)
            throws Exception {
        return script.run(calls.incrementAndGet(), payload, progress);
    }
}
