package com.legaldedup.service.visual;

import com.legaldedup.exception.VisualHashException;

/**
 * Image hashing collaborator.
 */
public interface PerceptualHashService {

    /**
     * @param imageRef file path or {@code file:} URI of a rendered page image
     * @return hex-encoded perceptual hash
     * @throws VisualHashException when the image cannot be read or hashed
     */
    String perceptualHash(String imageRef);
}
