package com.tethersystems.internal;

import com.tethersystems.Actor;
import com.tethersystems.ActorContext;
import com.tethersystems.ActorSystem;
import com.tethersystems.Pid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ActorContext} backed by an actor instance.
 */
final class ActorContextImpl implements ActorContext {

    private final Actor<?> actor;
    private final Logger logger;

    ActorContextImpl(Actor<?> actor) {
        this.actor = actor;
        this.logger = LoggerFactory.getLogger(actor.getClass().getName() + "." + actor.getActorId());
    }

    @Override
    public Pid self() {
        return actor.self();
    }

    @Override
    public String getActorId() {
        return actor.getActorId();
    }

    @Override
    public <T> void tell(Pid target, T message) {
        target.tell(message);
    }

    @Override
    public <T> void tellSelf(T message) {
        actor.self().tell(message);
    }

    @Override
    public <T> void tellSelf(T message, long delay, TimeUnit timeUnit) {
        actor.self().tell(message, delay, timeUnit);
    }

    @Override
    public Optional<Pid> getSender() {
        return actor.getSender();
    }

    @Override
    public ActorSystem getSystem() {
        return actor.getSystem();
    }

    @Override
    public void stop() {
        actor.stop();
    }

    @Override
    public Logger getLogger() {
        return logger;
    }
}
