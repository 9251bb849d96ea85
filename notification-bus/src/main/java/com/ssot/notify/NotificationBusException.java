package com.ssot.notify;

/**
 * Exception thrown when the notification bus itself fails, as opposed to one of its subscribers.
 */
public class NotificationBusException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotificationBusException(String message) {
        super(message);
    }

    public NotificationBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
