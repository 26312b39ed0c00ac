package com.legaldedup.exception;

public class VisualHashException extends DedupException {

    public VisualHashException(String message) {
        super(message);
    }

    public VisualHashException(String message, Throwable cause) {
        super(message, cause);
    }
}
