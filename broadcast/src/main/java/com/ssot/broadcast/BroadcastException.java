package com.ssot.broadcast;

/**
 * Unchecked exception for failures turning a change into an outgoing message.
 */
public class BroadcastException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BroadcastException(String message) {
        super(message);
    }

    public BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}
