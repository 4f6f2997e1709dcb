package com.tethersystems.live;

/**
 * Root of the exceptions raised by the live connection layer.
 */
public class TetherException extends RuntimeException {

    public TetherException(String message) {
        super(message);
    }

    public TetherException(String message, Throwable cause) {
        super(message, cause);
    }
}
