package com.tethersystems;

import com.tethersystems.config.MailboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Base class for actors. Messages are processed one at a time on the actor's mailbox thread,
 * so subclasses can keep plain mutable state without synchronization.
 *
 * @param <Message> The type of messages this actor accepts
 */
public abstract class Actor<Message> {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);

    private final String actorId;
    private final ActorSystem system;
    private final Pid pid;
    private final Logger actorLogger;
    private final MailboxProcessor<Message> mailboxProcessor;
    private final ThreadLocal<Pid> senderContext = new ThreadLocal<>();
    private volatile SupervisionStrategy supervisionStrategy = SupervisionStrategy.RESUME;

    protected Actor(ActorSystem system) {
        this(system, system.generateActorId());
    }

    protected Actor(ActorSystem system, String actorId) {
        this(system, actorId, system.getMailboxConfig());
    }

    protected Actor(ActorSystem system, String actorId, MailboxConfig mailboxConfig) {
        this.system = system;
        this.actorId = actorId != null ? actorId : system.generateActorId();
        this.pid = new Pid(this.actorId, system);
        this.actorLogger = LoggerFactory.getLogger(getClass().getName() + "." + this.actorId);
        MailboxConfig effective = mailboxConfig != null ? mailboxConfig : new MailboxConfig();
        this.mailboxProcessor = new MailboxProcessor<>(
                this.actorId,
                effective.createMailbox(),
                effective.getBatchSize(),
                this::handleException,
                new ActorLifecycle<>() {
                    @Override
                    public void preStart() {
                        Actor.this.preStart();
                    }

                    @Override
                    public void receive(Message message) {
                        dispatch(message);
                    }

                    @Override
                    public void postStop() {
                        Actor.this.postStop();
                    }
                },
                system.getThreadPoolFactory().createThreadFactory("actor-" + this.actorId),
                TimeUnit.SECONDS.toMillis(system.getThreadPoolFactory().getActorShutdownTimeoutSeconds()));
    }

    /**
     * Processes a single message. Always called on the mailbox thread.
     *
     * @param message The message to process
     */
    protected abstract void receive(Message message);

    protected void preStart() {
    }

    protected void postStop() {
        logger.debug("Actor {} stopped", actorId);
    }

    /**
     * Called before the supervision strategy is applied to a failure.
     *
     * @param message   The message being processed
     * @param exception The failure
     */
    protected void onError(Message message, Throwable exception) {
    }

    public void start() {
        mailboxProcessor.start();
        logger.debug("Actor {} started", actorId);
    }

    /**
     * Stops the actor: it is removed from its system, pending messages are discarded and
     * {@link #postStop()} runs. The id is free for a new actor while {@code postStop} is still running.
     */
    public void stop() {
        if (!mailboxProcessor.isRunning()) {
            return;
        }
        system.unregister(this);
        mailboxProcessor.stop();
    }

    public void tell(Message message) {
        mailboxProcessor.tell(message);
    }

    /**
     * Delivers a message that carries the sender to reply to.
     */
    @SuppressWarnings("unchecked")
    void tellWithSender(Object message, Pid sender) {
        mailboxProcessor.tell((Message) new ActorSystem.MessageWithSender<>(message, sender));
    }

    @SuppressWarnings("unchecked")
    private void dispatch(Object message) {
        if (message instanceof ActorSystem.MessageWithSender<?> wrapped) {
            senderContext.set(wrapped.sender());
            try {
                receive((Message) wrapped.message());
            } finally {
                senderContext.remove();
            }
        } else {
            receive((Message) message);
        }
    }

    @SuppressWarnings("unchecked")
    private void handleException(Message message, Throwable exception) {
        Object original = message instanceof ActorSystem.MessageWithSender<?> wrapped ? wrapped.message() : message;
        Supervisor.handleException(this, (Message) original, exception);
    }

    /**
     * The sender of the message currently being processed, present only while handling an ask.
     *
     * @return the sender, if any
     */
    public Optional<Pid> getSender() {
        return Optional.ofNullable(senderContext.get());
    }

    public Pid self() {
        return pid;
    }

    public String getActorId() {
        return actorId;
    }

    public ActorSystem getSystem() {
        return system;
    }

    public boolean isRunning() {
        return mailboxProcessor.isRunning();
    }

    public int getCurrentSize() {
        return mailboxProcessor.getCurrentSize();
    }

    /**
     * Logger named after the actor class and id, so a single connection can be filtered in the logs.
     *
     * @return the per-actor logger
     */
    protected Logger getLogger() {
        return actorLogger;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }

    public Actor<Message> withSupervisionStrategy(SupervisionStrategy strategy) {
        this.supervisionStrategy = strategy;
        return this;
    }
}
