package com.tethersystems;

/**
 * Unchecked exception thrown when an ask reply fails.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message) {
        super(message);
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
