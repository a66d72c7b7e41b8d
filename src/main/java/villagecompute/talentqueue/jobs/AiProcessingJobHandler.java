package villagecompute.talentqueue.jobs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.talentqueue.exceptions.NonRetryableJobException;
import villagecompute.talentqueue.integration.ai.AiInferenceGateway;
import villagecompute.talentqueue.jobs.payload.AiProcessingPayload;

/**
 * Runs AI inference for candidate profiles.
 *
 * <ul>
 * <li><b>embedding</b>: {@code {embedding, dimension}}</li>
 * <li><b>analysis</b>: {@link TextStatistics} plus the model's assessment under {@code analysis}</li>
 * <li><b>matching</b>: rates {@code text} against {@code metadata.jobDescription}; {@code {score, assessment}}</li>
 * </ul>
 */
@ApplicationScoped
public class AiProcessingJobHandler implements JobHandler<AiProcessingPayload> {

    private static final Logger LOG = Logger.getLogger(AiProcessingJobHandler.class);

    static final String JOB_DESCRIPTION_KEY = "jobDescription";

    private static final Pattern LEADING_SCORE = Pattern.compile("^\\D{0,20}?(\\d{1,3})");

    @Inject
    AiInferenceGateway aiGateway;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobQueue handlesQueue() {
        return JobQueue.AI;
    }

    @Override
    public Class<AiProcessingPayload> payloadType() {
        return AiProcessingPayload.class;
    }

    @Override
    public Map<String, Object> execute(Long jobId, AiProcessingPayload payload, JobProgress progress) {
        if (payload.type() == null) {
            throw new NonRetryableJobException("AI job " + jobId + " has no operation type");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            LOG.infof("Running AI %s for jobId=%d (%d characters)", payload.type(), jobId, payload.text().length());
            Map<String, Object> result = switch (payload.type()) {
                case EMBEDDING -> embedding(payload);
                case ANALYSIS -> analysis(payload);
                case MATCHING -> matching(payload);
            };
            status = "success";
            return result;
        } finally {
            sample.stop(Timer.builder("talentqueue_ai_processing_duration").tag("type", payload.type().name()
                    .toLowerCase(Locale.ROOT)).tag("status", status).register(meterRegistry));
        }
    }

    private Map<String, Object> embedding(AiProcessingPayload payload) {
        float[] vector = aiGateway.embed(payload.text());
        List<Float> embedding = new ArrayList<>(vector.length);
        for (float value : vector) {
            embedding.add(value);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("embedding", embedding);
        result.put("dimension", vector.length);
        return result;
    }

    private Map<String, Object> analysis(AiProcessingPayload payload) {
        TextStatistics stats = TextStatistics.of(payload.text());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("wordCount", stats.wordCount());
        result.put("characterCount", stats.characterCount());
        result.put("estimatedReadingTime", stats.estimatedReadingTime());
        result.put("complexity", stats.complexity());
        result.put("keyPhrases", stats.keyPhrases());
        result.put("analysis", aiGateway.analyze(payload.text()));
        result.put("metadata", payload.metadataOrEmpty());
        return result;
    }

    private Map<String, Object> matching(AiProcessingPayload payload) {
        Object jobDescription = payload.metadataOrEmpty().get(JOB_DESCRIPTION_KEY);
        if (!(jobDescription instanceof String description) || description.isBlank()) {
            throw new NonRetryableJobException("Matching requires metadata." + JOB_DESCRIPTION_KEY);
        }
        String assessment = aiGateway.assessMatch(payload.text(), description);

        Map<String, Object> result = new LinkedHashMap<>();
        Integer score = parseScore(assessment);
        if (score != null) {
            result.put("score", score);
        }
        result.put("assessment", assessment);
        return result;
    }

    /**
     * Reads the 0-100 rating the model is asked to put first; null when absent or out of range.
     */
    static Integer parseScore(String assessment) {
        if (assessment == null) {
            return null;
        }
        Matcher matcher = LEADING_SCORE.matcher(assessment.strip());
        if (!matcher.find()) {
            return null;
        }
        int score = Integer.parseInt(matcher.group(1));
        return score <= 100 ? score : null;
    }
}
