package com.legaldedup.dto.request;

import jakarta.validation.constraints.Positive;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchDetectionRequest {

    /** Whole registry when empty. */
    private List<String> documentIds;

    @Positive
    private Integer timeoutSeconds;
}
