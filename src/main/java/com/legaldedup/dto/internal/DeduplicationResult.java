package com.legaldedup.dto.internal;

import com.legaldedup.model.KeepStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationResult {

    private KeepStrategy keepStrategy;

    @Builder.Default
    private List<String> keptDocumentIds = new ArrayList<>();

    @Builder.Default
    private List<String> removedDocumentIds = new ArrayList<>();

    /**
     * Keeper id to the cluster it was chosen from.
     */
    @Builder.Default
    private Map<String, List<String>> keepers = new LinkedHashMap<>();
}
