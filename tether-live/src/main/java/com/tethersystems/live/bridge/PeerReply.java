package com.tethersystems.live.bridge;

/**
 * Outcome of a push-and-wait round trip.
 *
 * @param status How the call ended
 * @param value  The page's reply, the page's error, or the timeout message
 */
public record PeerReply(Status status, Object value) {

    public enum Status {
        OK, ERROR, TIMEOUT
    }

    public static PeerReply ok(Object value) {
        return new PeerReply(Status.OK, value);
    }

    public static PeerReply error(Object value) {
        return new PeerReply(Status.ERROR, value);
    }

    public static PeerReply timeout(long millis) {
        return new PeerReply(Status.TIMEOUT, "timed out after " + millis + " ms.");
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
