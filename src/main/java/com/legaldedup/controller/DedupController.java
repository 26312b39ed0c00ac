package com.legaldedup.controller;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.legaldedup.config.DedupConfig;
import com.legaldedup.dto.internal.DeduplicationResult;
import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.dto.internal.DuplicateCluster;
import com.legaldedup.dto.internal.DuplicateMatch;
import com.legaldedup.dto.request.BatchDetectionRequest;
import com.legaldedup.dto.request.DeduplicationRequest;
import com.legaldedup.dto.request.FingerprintRequest;
import com.legaldedup.dto.response.ClusterResponse;
import com.legaldedup.dto.response.DeduplicationResponse;
import com.legaldedup.dto.response.DetectionResponse;
import com.legaldedup.dto.response.FingerprintResponse;
import com.legaldedup.model.KeepStrategy;
import com.legaldedup.service.cluster.ClusterService;
import com.legaldedup.service.cluster.DeduplicationService;
import com.legaldedup.service.detection.DuplicateDetectionService;
import com.legaldedup.service.fingerprint.FingerprintService;
import com.legaldedup.service.monitoring.OperationTimer;
import com.legaldedup.service.monitoring.PerformanceMonitorService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DedupController {

    private final FingerprintService fingerprintService;
    private final DuplicateDetectionService detectionService;
    private final ClusterService clusterService;
    private final DeduplicationService deduplicationService;
    private final PerformanceMonitorService performanceMonitor;
    private final DedupConfig dedupConfig;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Legal Dedup API");

        Map<String, Object> features = new LinkedHashMap<>();
        features.put("semantic_embedding", dedupConfig.isEmbeddingEnabled());
        features.put("similarity_threshold", dedupConfig.getSimilarityThreshold());
        health.put("features", features);

        return ResponseEntity.ok(health);
    }

    @PostMapping("/fingerprints")
    public ResponseEntity<FingerprintResponse> createFingerprint(@Valid @RequestBody FingerprintRequest request) {
        log.info("Fingerprint requested for document: {}", request.getDocumentId());

        DocumentFingerprint fingerprint = fingerprintService.create(
                request.getDocumentId(),
                request.getText(),
                request.getMetadata(),
                request.getImageRef()
        );
        return ResponseEntity.ok(FingerprintResponse.from(fingerprint));
    }

    @GetMapping("/documents/{documentId}/duplicates")
    public ResponseEntity<DetectionResponse> findDuplicates(
            @PathVariable String documentId,
            @RequestParam(required = false) List<String> targetIds
    ) {
        log.info("Duplicate lookup for document: {}", documentId);

        OperationTimer timer = OperationTimer.start("api_find_duplicates");
        List<DuplicateMatch> matches = detectionService.findDuplicates(documentId, targetIds);
        timer.mark("Detect");

        return ResponseEntity.ok(DetectionResponse.builder()
                .documentId(documentId)
                .totalMatches(matches.size())
                .matches(matches)
                .timing(timer.end().toTimingInfo())
                .build());
    }

    @PostMapping("/duplicates/batch")
    public ResponseEntity<DetectionResponse> batchDetect(@Valid @RequestBody(required = false) BatchDetectionRequest request) {
        BatchDetectionRequest body = request != null ? request : new BatchDetectionRequest();
        log.info("Batch detection requested over {} documents",
                body.getDocumentIds() == null || body.getDocumentIds().isEmpty() ? "all" : body.getDocumentIds().size());

        OperationTimer timer = OperationTimer.start("api_batch_detect");
        List<DuplicateMatch> matches = detectionService.batchDetectDuplicates(
                body.getDocumentIds(), timeoutOf(body.getTimeoutSeconds()));
        timer.mark("Detect");

        return ResponseEntity.ok(DetectionResponse.builder()
                .totalMatches(matches.size())
                .matches(matches)
                .timing(timer.end().toTimingInfo())
                .build());
    }

    @PostMapping("/clusters")
    public ResponseEntity<ClusterResponse> clusters(@Valid @RequestBody(required = false) BatchDetectionRequest request) {
        BatchDetectionRequest body = request != null ? request : new BatchDetectionRequest();

        OperationTimer timer = OperationTimer.start("api_clusters");
        List<DuplicateCluster> clusters = clusterService.getDuplicateClusters(
                body.getDocumentIds(), timeoutOf(body.getTimeoutSeconds()));
        timer.mark("Cluster");

        return ResponseEntity.ok(ClusterResponse.builder()
                .totalClusters(clusters.size())
                .clusters(clusters.stream().map(DuplicateCluster::documentIds).toList())
                .timing(timer.end().toTimingInfo())
                .build());
    }

    @PostMapping("/deduplicate")
    public ResponseEntity<DeduplicationResponse> deduplicate(@Valid @RequestBody DeduplicationRequest request) {
        KeepStrategy strategy = KeepStrategy.from(request.getKeepStrategy());
        log.info("Deduplication requested with strategy: {}", strategy.wireName());

        OperationTimer timer = OperationTimer.start("api_deduplicate");
        DeduplicationResult result = deduplicationService.removeDuplicates(
                request.getDocumentIds(), strategy, timeoutOf(request.getTimeoutSeconds()));
        timer.mark("Resolve");

        return ResponseEntity.ok(DeduplicationResponse.from(result, timer.end().toTimingInfo()));
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Object>> statistics() {
        return ResponseEntity.ok(detectionService.getStatistics());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache() {
        log.info("Clearing comparison cache");
        detectionService.clearCache();
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<?> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<?> performanceHistory() {
        var history = performanceMonitor.getHistory();
        return ResponseEntity.ok(Map.of("totalOperations", history.size(), "history", history));
    }

    private static Duration timeoutOf(Integer timeoutSeconds) {
        return timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null;
    }
}
