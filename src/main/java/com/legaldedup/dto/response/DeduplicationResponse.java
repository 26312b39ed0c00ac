package com.legaldedup.dto.response;

import com.legaldedup.dto.internal.DeduplicationResult;
import com.legaldedup.dto.internal.TimingInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationResponse {

    private String keepStrategy;

    private List<String> keptDocumentIds;

    private List<String> removedDocumentIds;

    private Map<String, List<String>> keepers;

    private TimingInfo timing;

    public static DeduplicationResponse from(DeduplicationResult result, TimingInfo timing) {
        return DeduplicationResponse.builder()
                .keepStrategy(result.getKeepStrategy() != null ? result.getKeepStrategy().wireName() : null)
                .keptDocumentIds(result.getKeptDocumentIds())
                .removedDocumentIds(result.getRemovedDocumentIds())
                .keepers(result.getKeepers())
                .timing(timing)
                .build();
    }
}
