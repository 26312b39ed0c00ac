package com.legaldedup.service.embedding;

import com.legaldedup.exception.EmbeddingException;

import java.util.List;

/**
 * Text embedding collaborator.
 */
public interface EmbeddingClient {

    /**
     * Embeds at most {@code maxChars} leading characters of the text.
     *
     * @return the complete embedding vector
     * @throws EmbeddingException when the service fails or answers with an unusable payload
     */
    List<Double> embed(String text, int maxChars);
}
