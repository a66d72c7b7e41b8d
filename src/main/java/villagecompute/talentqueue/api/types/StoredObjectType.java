package villagecompute.talentqueue.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of uploading an object to candidate storage.
 *
 * @param objectKey
 *            full object key, e.g. {@code candidates/42/resume/cv.pdf}
 * @param bucket
 *            bucket the object was written to
 * @param url
 *            public URL of the object
 * @param sizeBytes
 *            stored size in bytes
 * @param contentType
 *            MIME type recorded on the object
 */
public record StoredObjectType(@JsonProperty("object_key") String objectKey, @JsonProperty("bucket") String bucket,
        @JsonProperty("url") String url, @JsonProperty("size_bytes") long sizeBytes,
        @JsonProperty("content_type") String contentType) {
}
