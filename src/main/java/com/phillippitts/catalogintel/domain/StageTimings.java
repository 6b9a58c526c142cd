package com.phillippitts.catalogintel.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Elapsed nanoseconds per pipeline stage. Immutable; stages that never ran are absent.
 */
public final class StageTimings {

    private static final StageTimings EMPTY = new StageTimings(new EnumMap<>(PipelineStage.class));

    private final Map<PipelineStage, Long> nanos;

    private StageTimings(EnumMap<PipelineStage, Long> nanos) {
        this.nanos = Collections.unmodifiableMap(nanos);
    }

    public static StageTimings empty() {
        return EMPTY;
    }

    public StageTimings with(PipelineStage stage, long elapsedNanos) {
        EnumMap<PipelineStage, Long> copy = copy();
        copy.merge(stage, Math.max(0L, elapsedNanos), Long::sum);
        return new StageTimings(copy);
    }

    public StageTimings plus(StageTimings other) {
        EnumMap<PipelineStage, Long> copy = copy();
        other.nanos.forEach((stage, value) -> copy.merge(stage, value, Long::sum));
        return new StageTimings(copy);
    }

    public long nanos(PipelineStage stage) {
        return nanos.getOrDefault(stage, 0L);
    }

    public long millis(PipelineStage stage) {
        return nanos(stage) / 1_000_000L;
    }

    public long totalNanos() {
        return nanos.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<PipelineStage, Long> asMap() {
        return nanos;
    }

    private EnumMap<PipelineStage, Long> copy() {
        EnumMap<PipelineStage, Long> copy = new EnumMap<>(PipelineStage.class);
        copy.putAll(nanos);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage == PipelineStage.ADMISSION) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(stage.wireName()).append('=').append(millis(stage)).append("ms");
        }
        return sb.toString();
    }
}
