package com.mcainsights.mcainsights.diff;

import com.mcainsights.mcainsights.common.ChangeDetectionConstants;
import com.mcainsights.mcainsights.snapshot.ValueNormalizer;

import java.util.List;
import java.util.Objects;

/**
 * Explicit configuration of a {@link DiffEngine}. Context field names may be null when a schema lacks them.
 *
 * @param parallelThreshold common-key count from which field comparison is sharded across workers
 * @param shardSize         keys per worker shard
 */
public record DiffSettings(
        List<String> trackedFields,
        String nameField,
        String stateField,
        String statusField,
        ValueNormalizer normalizer,
        int parallelThreshold,
        int shardSize
) {

    public DiffSettings {
        trackedFields = List.copyOf(trackedFields);
        Objects.requireNonNull(normalizer, "normalizer");
        if (trackedFields.isEmpty()) {
            throw new IllegalArgumentException("At least one tracked field is required");
        }
        if (shardSize < 1) {
            throw new IllegalArgumentException("Shard size must be positive: " + shardSize);
        }
    }

    /**
     * Registry defaults for the given normalizer.
     */
    public static DiffSettings registryDefaults(ValueNormalizer normalizer) {
        return new DiffSettings(
                ChangeDetectionConstants.DEFAULT_TRACKED_FIELDS,
                ChangeDetectionConstants.DEFAULT_NAME_FIELD,
                ChangeDetectionConstants.DEFAULT_STATE_FIELD,
                ChangeDetectionConstants.DEFAULT_STATUS_FIELD,
                normalizer,
                ChangeDetectionConstants.DEFAULT_PARALLEL_THRESHOLD,
                ChangeDetectionConstants.DEFAULT_SHARD_SIZE
        );
    }
}
