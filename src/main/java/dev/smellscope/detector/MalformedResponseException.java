package dev.smellscope.detector;

/**
 * A backend answered 2xx with a body that does not match its contract.
 */
public class MalformedResponseException extends RuntimeException {
    public MalformedResponseException(String message) {
        super(message);
    }
}
