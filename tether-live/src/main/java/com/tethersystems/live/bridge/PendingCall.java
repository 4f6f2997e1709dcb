package com.tethersystems.live.bridge;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A push waiting for its reply. Completed at most once.
 *
 * @param correlationId Pairs the reply with this call
 * @param connectionId  The socket the push went to
 * @param callerThread  Name of the waiting thread, for diagnostics
 * @param deadline      When the caller gives up, or null to wait forever
 * @param reply         Completed by the matching reply
 */
record PendingCall(String correlationId,
                   String connectionId,
                   String callerThread,
                   Instant deadline,
                   CompletableFuture<PeerReply> reply) {

    boolean resolve(PeerReply value) {
        return reply.complete(value);
    }
}
