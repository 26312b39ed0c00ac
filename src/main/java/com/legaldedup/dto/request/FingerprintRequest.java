package com.legaldedup.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FingerprintRequest {

    @NotBlank
    private String documentId;

    @NotNull
    private String text;

    private Map<String, Object> metadata;

    /**
     * Path or file URI of the rendered first page.
     */
    private String imageRef;
}
