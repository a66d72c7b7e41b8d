package villagecompute.talentqueue.jobs;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import villagecompute.talentqueue.exceptions.ValidationException;
import villagecompute.talentqueue.jobs.payload.JobPayload;

/**
 * JSON codec for job payloads and results as stored in the broker's text columns.
 *
 * <p>
 * Payloads are written without a type discriminator; the queue column selects the record type on the way back.
 */
@ApplicationScoped
public class JobPayloadCodec {

    private static final TypeReference<Map<String, Object>> RESULT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Inject
    public JobPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encodePayload(JobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes a stored payload into the queue's record type.
     *
     * @throws IllegalArgumentException
     *             if the JSON does not match the queue's payload shape
     */
    public JobPayload decodePayload(JobQueue queue, String json) {
        try {
            return objectMapper.readValue(json, queue.getPayloadType());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Stored payload is not a valid " + queue.getPayloadType().getSimpleName() + ": "
                            + e.getOriginalMessage(),
                    e);
        }
    }

    /**
     * Converts loosely typed request data (e.g. a JSON object posted to the REST API) into the queue's payload record.
     *
     * @throws ValidationException
     *             if the data does not fit the payload shape
     */
    public JobPayload convertPayload(JobQueue queue, Map<String, Object> data) {
        if (data == null) {
            throw new ValidationException("Payload is required for queue " + queue.getName());
        }
        try {
            return objectMapper.convertValue(data, queue.getPayloadType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid payload for queue " + queue.getName() + ": " + e.getMessage(), e);
        }
    }

    public String encodeResult(Map<String, Object> result) {
        if (result == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job result cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> decodeResult(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, RESULT_TYPE);
        } catch (JsonProcessingException e) {
            return Map.of("raw", json);
        }
    }
}
