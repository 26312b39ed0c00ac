package com.legaldedup.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeduplicationRequest {

    private List<String> documentIds;

    /**
     * newest, oldest, longest or shortest
     */
    @NotBlank
    private String keepStrategy;

    @Positive
    private Integer timeoutSeconds;
}
