package com.ivamare.reliability.job;

import com.ivamare.reliability.support.CanonicalJson;
import com.ivamare.reliability.support.Hashing;

import java.util.HashMap;
import java.util.Map;

/**
 * Computes and verifies {@link JobCheckpoint#checksum()}.
 *
 * <p>The checksum is SHA-256 hex of the canonical JSON of every field except the
 * id and the checksum itself. Metadata must already be normalized through
 * {@link #normalizeMetadata(Map)} so a stored checkpoint re-hashes identically.
 */
public class CheckpointChecksums {

    private final CanonicalJson json;

    public CheckpointChecksums(CanonicalJson json) {
        this.json = json;
    }

    public String compute(JobCheckpoint checkpoint) {
        Map<String, Object> content = new HashMap<>();
        content.put("jobId", checkpoint.jobId());
        content.put("executionId", checkpoint.executionId());
        content.put("stepName", checkpoint.stepName());
        content.put("stepNumber", checkpoint.stepNumber());
        content.put("dataProcessed", checkpoint.dataProcessed());
        content.put("totalData", checkpoint.totalData());
        content.put("state", checkpoint.state().name());
        content.put("metadata", checkpoint.metadata());
        content.put("timestamp", checkpoint.timestamp().toString());
        return Hashing.sha256Hex(json.write(content));
    }

    public boolean verify(JobCheckpoint checkpoint) {
        return checkpoint.checksum() != null && Hashing.matches(checkpoint.checksum(), compute(checkpoint));
    }

    /**
     * Round-trip metadata through JSON so numbers and nesting take their stored form.
     */
    public Map<String, Object> normalizeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return json.readMap(json.write(metadata));
    }
}
