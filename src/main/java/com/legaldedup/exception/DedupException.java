package com.legaldedup.exception;

public class DedupException extends RuntimeException {
    
    public DedupException(String message) {
        super(message);
    }
    
    public DedupException(String message, Throwable cause) {
        super(message, cause);
    }
}
