package com.tethersystems.live;

import com.tethersystems.ActorSystem;
import com.tethersystems.live.bridge.PeerReply;
import com.tethersystems.live.bridge.RequestResponseBridge;
import com.tethersystems.live.bridge.TokenSigner;
import com.tethersystems.live.capability.CoreCommands;
import com.tethersystems.live.capability.ModalDialogs;
import com.tethersystems.live.commander.CommanderBinding;
import com.tethersystems.live.config.TetherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Channel-side entry point. Keeps one {@link ConnectionActor} per joined socket and turns
 * inbound frames into actor messages or bridge replies.
 *
 * <pre>{@code
 * ConnectionEndpoint endpoint = new ConnectionEndpoint(system, binding, TetherConfig.load());
 * endpoint.join(socket, joinPayload);
 * endpoint.handleIn(socket.id(), "event", framePayload);
 * endpoint.leave(socket.id());
 * }</pre>
 */
public class ConnectionEndpoint implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionEndpoint.class);

    public static final String ONLOAD = "onload";
    public static final String EVENT = "event";

    private final ActorSystem system;
    private final CommanderBinding binding;
    private final TetherConfig config;
    private final RequestResponseBridge bridge;
    private final FailureReporter reporter;
    private final CoreCommands commands;
    private final ModalDialogs dialogs;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong incarnations = new AtomicLong();

    private record Connection(ConnectionActor actor, ConnectionRef ref, LiveSocket socket) {
    }

    public ConnectionEndpoint(ActorSystem system, CommanderBinding binding, TetherConfig config) {
        this.system = system;
        this.binding = binding;
        this.config = config;
        this.bridge = new RequestResponseBridge(
                new TokenSigner(tokenSecret(config), config.getTokenMaxAge()),
                config.getBrowserResponseTimeout());
        this.reporter = new FailureReporter(config, bridge);
        this.commands = new CoreCommands(bridge);
        this.dialogs = new ModalDialogs(bridge);
    }

    /**
     * Connects a socket. A socket id that is already connected keeps its actor, and with it the store.
     * After a leave the next join gets a new actor, even while the old one is still disconnecting.
     *
     * @param socket  The joining socket
     * @param payload The join payload, may carry {@code session} and {@code store}
     * @return the connection reference
     */
    public ConnectionRef join(LiveSocket socket, Map<String, Object> payload) {
        Connection connection = connections.compute(socket.id(), (id, existing) -> {
            ConnectionActor actor = existing != null && existing.actor().isRunning()
                    ? existing.actor()
                    : system.register(new ConnectionActor(system, nextActorId(id), binding, reporter, config));
            ConnectionRef ref = existing != null && existing.actor() == actor
                    ? existing.ref()
                    : new ConnectionRef(actor.self(), config.getStateTimeout());
            return new Connection(actor, ref, socket.withConnection(ref));
        });
        connection.actor().tell(new ConnectionMessage.Connect(connection.socket(), payload));
        logger.debug("Socket {} joined", socket.id());
        return connection.ref();
    }

    /**
     * Handles an inbound frame.
     * Frames carrying a {@code sender} token and an {@code ok} or {@code error} key are replies
     * to push-and-wait calls; {@code onload} and {@code event} frames go to the connection actor.
     *
     * @param socketId The socket the frame arrived on
     * @param event    The frame's event name
     * @param payload  The frame's payload
     * @throws com.tethersystems.live.bridge.TokenVerificationException if a reply carries a bad token
     */
    public void handleIn(String socketId, String event, Map<String, Object> payload) {
        Map<String, Object> frame = payload == null ? Map.of() : payload;
        Object sender = frame.get(RequestResponseBridge.SENDER_KEY);
        if (sender instanceof String && (frame.containsKey("ok") || frame.containsKey("error"))) {
            boolean ok = frame.containsKey("ok");
            bridge.deliverReply((String) sender,
                    ok ? PeerReply.Status.OK : PeerReply.Status.ERROR,
                    frame.get(ok ? "ok" : "error"));
            return;
        }

        Connection connection = connections.get(socketId);
        if (connection == null) {
            logger.warn("Frame {} for unknown socket {} dropped", event, socketId);
            return;
        }
        if (ONLOAD.equals(event)) {
            connection.actor().tell(new ConnectionMessage.Load(connection.socket()));
        } else if (EVENT.equals(event)) {
            EventInvocation invocation = new EventInvocation(
                    asString(frame.get("event")),
                    asString(frame.get(ConnectionActor.EVENT_HANDLER_KEY)),
                    frame,
                    frame.get("reply_to"));
            connection.actor().tell(new ConnectionMessage.Event(invocation, connection.socket()));
        } else {
            logger.warn("Unknown frame {} on socket {}", event, socketId);
        }
    }

    /**
     * Disconnects a socket: stops its actor, which runs the on-disconnect callback.
     *
     * @param socketId The socket id
     */
    public void leave(String socketId) {
        Connection connection = connections.remove(socketId);
        if (connection != null) {
            connection.actor().stop();
            logger.debug("Socket {} left", socketId);
        }
    }

    public Optional<ConnectionRef> connection(String socketId) {
        Connection connection = connections.get(socketId);
        return connection == null ? Optional.empty() : Optional.of(connection.ref());
    }

    public int connectionCount() {
        return connections.size();
    }

    public RequestResponseBridge bridge() {
        return bridge;
    }

    public FailureReporter reporter() {
        return reporter;
    }

    public CoreCommands commands() {
        return commands;
    }

    public ModalDialogs dialogs() {
        return dialogs;
    }

    @Override
    public void close() {
        for (String socketId : List.copyOf(connections.keySet())) {
            leave(socketId);
        }
    }

    // a rejoin must not reach the actor of the previous connection, which may still be stopping
    private String nextActorId(String socketId) {
        return "connection-" + socketId + "-" + incarnations.incrementAndGet();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static String tokenSecret(TetherConfig config) {
        if (config.getTokenSecret() != null) {
            return config.getTokenSecret();
        }
        byte[] random = new byte[32];
        new SecureRandom().nextBytes(random);
        logger.info("No token secret configured, using a random one; sender tokens will not survive a restart");
        return Base64.getEncoder().encodeToString(random);
    }
}
