package com.legaldedup.service.monitoring;

import com.legaldedup.dto.internal.TimingInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call stopwatch with named checkpoints. Not thread-safe; create one per operation.
 */
public class OperationTimer {

    private final String operation;

    private final long startTime;

    private Long endTime;

    private final Map<String, Long> checkpoints = new LinkedHashMap<>();

    private OperationTimer(String operation) {
        this.operation = operation;
        this.startTime = System.nanoTime();
    }

    public static OperationTimer start(String operation) {
        return new OperationTimer(operation);
    }

    public void mark(String stepName) {
        checkpoints.put(stepName, System.nanoTime() - startTime);
    }

    public OperationTimer end() {
        if (endTime == null) {
            endTime = System.nanoTime();
        }
        return this;
    }

    public String getOperation() {
        return operation;
    }

    public double getTotalTime() {
        long end = endTime != null ? endTime : System.nanoTime();
        return (end - startTime) / 1_000_000_000.0;
    }

    /**
     * Seconds spent between consecutive checkpoints.
     */
    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long previous = 0L;
        for (Map.Entry<String, Long> entry : checkpoints.entrySet()) {
            durations.put(entry.getKey(), (entry.getValue() - previous) / 1_000_000_000.0);
            previous = entry.getValue();
        }

        return durations;
    }

    public TimingInfo toTimingInfo() {
        return TimingInfo.builder()
                .operation(operation)
                .totalTime(getTotalTime())
                .stepDurations(getStepDurations())
                .timestamp(Instant.now().toString())
                .build();
    }
}
