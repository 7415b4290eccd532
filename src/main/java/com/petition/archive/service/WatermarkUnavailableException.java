package com.petition.archive.service;

/**
 * Thrown when no safe watermark can be computed, typically because the queue
 * status could not be read. The run must abort rather than fall back to a stale
 * or zero watermark.
 */
public class WatermarkUnavailableException extends RuntimeException {

    public WatermarkUnavailableException(String message) {
        super(message);
    }

    public WatermarkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
