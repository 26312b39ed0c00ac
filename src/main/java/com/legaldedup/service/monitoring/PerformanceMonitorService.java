package com.legaldedup.service.monitoring;

import com.legaldedup.config.DedupConfig;
import com.legaldedup.dto.internal.TimingInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded history of bulk operation timings with per-operation aggregates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private final DedupConfig dedupConfig;

    private final Deque<OperationRecord> history = new ConcurrentLinkedDeque<>();

    public void record(OperationTimer timer, int subjectCount, int resultCount) {
        if (!dedupConfig.isMonitoringEnabled()) {
            return;
        }

        TimingInfo timing = timer.end().toTimingInfo();
        history.addLast(new OperationRecord(
                Instant.now().toString(),
                timer.getOperation(),
                subjectCount,
                resultCount,
                timing.getTotalTime(),
                timing.getStepDurations()
        ));

        while (history.size() > dedupConfig.getMaxOperationHistory()) {
            history.pollFirst();
        }

        log.debug("{} over {} documents -> {} results in {}s",
                timer.getOperation(), subjectCount, resultCount, String.format("%.3f", timing.getTotalTime()));
    }

    public List<OperationRecord> getHistory() {
        return List.copyOf(history);
    }

    public Map<String, Object> getStatistics() {
        if (history.isEmpty()) {
            return Map.of("message", "No operations recorded yet");
        }

        Map<String, List<Double>> byOperation = new TreeMap<>();
        for (OperationRecord record : history) {
            byOperation.computeIfAbsent(record.operation(), k -> new ArrayList<>())
                    .add(record.totalTime());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalOperations", history.size());

        Map<String, Map<String, Object>> operationStats = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : byOperation.entrySet()) {
            List<Double> times = entry.getValue();
            Map<String, Object> operationStat = new LinkedHashMap<>();
            operationStat.put("count", times.size());
            operationStat.put("avg", average(times));
            operationStat.put("median", median(times));
            operationStat.put("min", Collections.min(times));
            operationStat.put("max", Collections.max(times));
            operationStats.put(entry.getKey(), operationStat);
        }
        stats.put("operations", operationStats);

        return stats;
    }

    private double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size % 2 == 0) {
            return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        } else {
            return sorted.get(size / 2);
        }
    }

    public record OperationRecord(
        String timestamp,
        String operation,
        int subjectCount,
        int resultCount,
        Double totalTime,
        Map<String, Double> stepDurations
    ) {
    }
}
