package com.tethersystems.live.bridge;

import com.tethersystems.live.LiveSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns fire-and-forget pushes into blocking request/response calls.
 * <p>
 * Every push carries a signed {@code sender} token naming the connection and a fresh correlation id.
 * The page echoes the token with its reply, which {@link #deliverReply} routes back to the waiting
 * caller. Only the calling thread blocks; a timeout does not cancel anything on the page.
 */
public class RequestResponseBridge {

    private static final Logger logger = LoggerFactory.getLogger(RequestResponseBridge.class);

    public static final String SENDER_KEY = "sender";
    static final String TOKEN_SALT = "tether token";

    private final TokenSigner signer;
    private final Duration defaultTimeout;
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();

    public RequestResponseBridge(TokenSigner signer, Duration defaultTimeout) {
        this.signer = signer;
        this.defaultTimeout = defaultTimeout;
    }

    public PeerReply pushAndWait(LiveSocket socket, String message, Map<String, Object> payload) {
        return pushAndWait(socket, message, payload, defaultTimeout);
    }

    /**
     * Pushes a message and blocks until the page replies or the timeout passes.
     *
     * @param socket  Target connection
     * @param message Event name
     * @param payload Event payload; a {@code sender} token is added
     * @param timeout How long to wait, zero or more
     * @return the reply, or a {@link PeerReply.Status#TIMEOUT} reply
     */
    public PeerReply pushAndWait(LiveSocket socket, String message, Map<String, Object> payload, Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }
        return await(socket, message, payload, timeout);
    }

    /**
     * Pushes a message and blocks until the page replies, without a deadline.
     * Used for dialogs that wait on the user.
     */
    public PeerReply pushAndWaitForever(LiveSocket socket, String message, Map<String, Object> payload) {
        return await(socket, message, payload, null);
    }

    public void push(LiveSocket socket, String message, Map<String, Object> payload) {
        socket.push(message, withSender(payload, socket, newCorrelationId()));
    }

    public void broadcast(LiveSocket socket, String message, Map<String, Object> payload) {
        socket.broadcast(message, withSender(payload, socket, newCorrelationId()));
    }

    /**
     * Routes a reply from the page to the call waiting for it.
     *
     * @param senderToken The token echoed by the page
     * @param status      {@link PeerReply.Status#OK} or {@link PeerReply.Status#ERROR}
     * @param value       The reply value
     * @return true if a waiting call received it, false if none was waiting (late or duplicate reply)
     * @throws TokenVerificationException if the token does not verify; an expired token first
     *                                    resolves its waiting call with {@link PeerReply.Status#ERROR}
     */
    public boolean deliverReply(String senderToken, PeerReply.Status status, Object value) {
        String subject;
        try {
            subject = signer.verify(TOKEN_SALT, senderToken);
        } catch (TokenVerificationException e) {
            if (e.getReason() == TokenVerificationException.Reason.EXPIRED) {
                failWaitingCall(signer.verifySignature(TOKEN_SALT, senderToken), e);
            }
            throw e;
        }
        String correlationId = correlationId(subject);

        PendingCall call = pending.remove(correlationId);
        if (call == null) {
            logger.debug("Discarding reply with no pending call: {}", correlationId);
            return false;
        }
        return call.resolve(new PeerReply(status, value));
    }

    private void failWaitingCall(String subject, TokenVerificationException cause) {
        PendingCall call = pending.remove(correlationId(subject));
        if (call != null) {
            logger.warn("Reply to {} on {} arrived with an expired token", call.correlationId(), call.connectionId());
            call.resolve(PeerReply.error(cause.getMessage()));
        }
    }

    private static String correlationId(String subject) {
        int separator = subject.lastIndexOf(':');
        return separator >= 0 ? subject.substring(separator + 1) : subject;
    }

    public int pendingCount() {
        return pending.size();
    }

    private PeerReply await(LiveSocket socket, String message, Map<String, Object> payload, Duration timeout) {
        String correlationId = newCorrelationId();
        Instant deadline = timeout == null ? null : Instant.now().plus(timeout);
        PendingCall call = new PendingCall(correlationId, socket.id(), Thread.currentThread().getName(),
                deadline, new CompletableFuture<>());
        pending.put(correlationId, call);
        try {
            socket.push(message, withSender(payload, socket, correlationId));
            if (timeout == null) {
                return call.reply().get();
            }
            return call.reply().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.debug("{} on {} timed out after {} ms", message, socket.id(), timeout.toMillis());
            return PeerReply.timeout(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PeerReply.error("interrupted while waiting for " + message);
        } catch (ExecutionException e) {
            return PeerReply.error(e.getCause().getMessage());
        } finally {
            pending.remove(correlationId);
        }
    }

    private Map<String, Object> withSender(Map<String, Object> payload, LiveSocket socket, String correlationId) {
        Map<String, Object> message = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        message.put(SENDER_KEY, signer.sign(TOKEN_SALT, socket.id() + ":" + correlationId));
        return message;
    }

    private static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
