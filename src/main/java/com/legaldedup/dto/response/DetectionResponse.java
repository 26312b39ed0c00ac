package com.legaldedup.dto.response;

import com.legaldedup.dto.internal.DuplicateMatch;
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
public class DetectionResponse {

    /** Set for one-to-many detection only. */
    private String documentId;

    private int totalMatches;

    private List<DuplicateMatch> matches;

    private TimingInfo timing;
}
