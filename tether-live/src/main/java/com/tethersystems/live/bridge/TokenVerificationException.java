package com.tethersystems.live.bridge;

import com.tethersystems.live.TetherException;

/**
 * A sender token was malformed, forged or expired.
 */
public class TokenVerificationException extends TetherException {

    private final Reason reason;

    public enum Reason {
        INVALID, EXPIRED
    }

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
