package com.legaldedup.service.cluster;

import com.legaldedup.dto.internal.DeduplicationResult;
import com.legaldedup.dto.internal.DocumentFingerprint;
import com.legaldedup.dto.internal.DuplicateCluster;
import com.legaldedup.model.KeepStrategy;
import com.legaldedup.service.fingerprint.FingerprintRegistry;
import com.legaldedup.service.monitoring.OperationTimer;
import com.legaldedup.service.monitoring.PerformanceMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Picks one surviving document per duplicate cluster.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    private final ClusterService clusterService;
    private final FingerprintRegistry registry;
    private final PerformanceMonitorService performanceMonitor;

    public DeduplicationResult removeDuplicates(Collection<String> documentIds, KeepStrategy keepStrategy) {
        return removeDuplicates(documentIds, keepStrategy, null);
    }

    /**
     * Keeps one document per cluster and every document outside a cluster. Ties under
     * the strategy go to the smallest document id, so repeated runs over unchanged
     * fingerprints give the same keep-list.
     */
    public DeduplicationResult removeDuplicates(
            Collection<String> documentIds,
            KeepStrategy keepStrategy,
            Duration timeout
    ) {
        if (keepStrategy == null) {
            throw new IllegalArgumentException("Keep strategy is required");
        }
        if (documentIds == null || documentIds.isEmpty()) {
            return DeduplicationResult.builder().keepStrategy(keepStrategy).build();
        }

        OperationTimer timer = OperationTimer.start("remove_duplicates");
        List<DuplicateCluster> clusters = clusterService.getDuplicateClusters(documentIds, timeout);
        timer.mark("Cluster");

        SortedSet<String> kept = new TreeSet<>(documentIds);
        SortedSet<String> removed = new TreeSet<>();
        Map<String, List<String>> keepers = new LinkedHashMap<>();

        for (DuplicateCluster cluster : clusters) {
            DocumentFingerprint keeper = selectKeeper(
                    registry.requireAll(cluster.documentIds()).values(), keepStrategy);

            for (String documentId : cluster.documentIds()) {
                if (!documentId.equals(keeper.getDocumentId())) {
                    kept.remove(documentId);
                    removed.add(documentId);
                }
            }
            keepers.put(keeper.getDocumentId(), cluster.documentIds());
        }
        timer.mark("Resolve");

        log.info("remove_duplicates({}) over {} documents: kept {}, removed {}",
                keepStrategy.wireName(), documentIds.size(), kept.size(), removed.size());
        performanceMonitor.record(timer, documentIds.size(), removed.size());

        return DeduplicationResult.builder()
                .keepStrategy(keepStrategy)
                .keptDocumentIds(new ArrayList<>(kept))
                .removedDocumentIds(new ArrayList<>(removed))
                .keepers(keepers)
                .build();
    }

    static DocumentFingerprint selectKeeper(Collection<DocumentFingerprint> members, KeepStrategy strategy) {
        Comparator<DocumentFingerprint> preference;
        switch (strategy) {
            case NEWEST:
                preference = Comparator.comparing(DocumentFingerprint::getCreatedAt).reversed();
                break;
            case OLDEST:
                preference = Comparator.comparing(DocumentFingerprint::getCreatedAt);
                break;
            case LONGEST:
                preference = Comparator.comparingInt(DocumentFingerprint::getWordCount).reversed();
                break;
            case SHORTEST:
                preference = Comparator.comparingInt(DocumentFingerprint::getWordCount);
                break;
            default:
                throw new IllegalArgumentException("Unsupported keep strategy: " + strategy);
        }

        return members.stream()
                .min(preference.thenComparing(DocumentFingerprint::getDocumentId))
                .orElseThrow(() -> new IllegalArgumentException("Cluster has no members"));
    }
}
