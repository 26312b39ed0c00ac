package com.legaldedup.service.cluster;

import com.legaldedup.dto.internal.DuplicateCluster;
import com.legaldedup.dto.internal.DuplicateMatch;
import com.legaldedup.service.detection.DuplicateDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups documents into duplicate clusters: connected components of the graph whose
 * edges are the cluster-forming matches (EXACT, NEAR_EXACT, VERSION, SIMILAR).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterService {

    private final DuplicateDetectionService detectionService;

    public List<DuplicateCluster> getDuplicateClusters(Collection<String> documentIds) {
        return getDuplicateClusters(documentIds, null);
    }

    /**
     * @return clusters of two or more documents, largest first
     */
    public List<DuplicateCluster> getDuplicateClusters(Collection<String> documentIds, Duration timeout) {
        List<DuplicateMatch> matches = detectionService.batchDetectDuplicates(documentIds, timeout);
        List<DuplicateCluster> clusters = buildClusters(matches);
        log.info("Built {} duplicate clusters from {} matches", clusters.size(), matches.size());
        return clusters;
    }

    /**
     * Connected components over the given matches, found by an explicit-stack traversal
     * of a private copy of the edge set.
     */
    public static List<DuplicateCluster> buildClusters(List<DuplicateMatch> matches) {
        Map<String, Set<String>> graph = new TreeMap<>();
        for (DuplicateMatch match : List.copyOf(matches)) {
            if (!match.getDuplicateType().isClusterForming()) {
                continue;
            }
            String doc1 = match.getDocumentId1();
            String doc2 = match.getDocumentId2();
            graph.computeIfAbsent(doc1, k -> new TreeSet<>()).add(doc2);
            graph.computeIfAbsent(doc2, k -> new TreeSet<>()).add(doc1);
        }

        Set<String> visited = new HashSet<>();
        List<DuplicateCluster> clusters = new ArrayList<>();

        for (String start : graph.keySet()) {
            if (visited.contains(start)) {
                continue;
            }

            List<String> members = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);

            while (!stack.isEmpty()) {
                String current = stack.pop();
                if (!visited.add(current)) {
                    continue;
                }
                members.add(current);
                for (String neighbor : graph.getOrDefault(current, Set.of())) {
                    if (!visited.contains(neighbor)) {
                        stack.push(neighbor);
                    }
                }
            }

            if (members.size() > 1) {
                members.sort(Comparator.naturalOrder());
                clusters.add(new DuplicateCluster(members));
            }
        }

        clusters.sort(Comparator.comparingInt(DuplicateCluster::size).reversed()
                .thenComparing(DuplicateCluster::firstDocumentId));
        return clusters;
    }
}
