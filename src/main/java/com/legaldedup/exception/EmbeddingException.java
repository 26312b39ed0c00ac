package com.legaldedup.exception;

public class EmbeddingException extends DedupException {
    
    public EmbeddingException(String message) {
        super(message);
    }
    
    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
