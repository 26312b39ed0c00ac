package com.legaldedup.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class DetectionTimeoutException extends DedupException {

    private final Duration timeout;

    public DetectionTimeoutException(Duration timeout, Throwable cause) {
        super("Duplicate detection did not finish within " + timeout.toSeconds() + "s", cause);
        this.timeout = timeout;
    }
}
