package dev.smellscope.exception;

/**
 * Caller error in an analysis request. Surfaced as HTTP 400, never retried.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
