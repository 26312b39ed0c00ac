package com.legaldedup.dto.response;

import com.legaldedup.dto.internal.TimingInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterResponse {

    private int totalClusters;

    /** Member ids per cluster, largest cluster first. */
    private List<List<String>> clusters;

    private TimingInfo timing;
}
