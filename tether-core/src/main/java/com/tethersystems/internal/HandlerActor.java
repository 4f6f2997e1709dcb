package com.tethersystems.internal;

import com.tethersystems.Actor;
import com.tethersystems.ActorContext;
import com.tethersystems.ActorSystem;
import com.tethersystems.handler.Handler;

/**
 * Actor that delegates to a {@link Handler}. Created through {@link ActorSystem#spawn}.
 *
 * @param <Message> The type of messages this actor processes
 */
public class HandlerActor<Message> extends Actor<Message> {

    private final Handler<Message> handler;
    private final ActorContext context;

    public HandlerActor(ActorSystem system, String actorId, Handler<Message> handler) {
        super(system, actorId);
        this.handler = handler;
        this.context = new ActorContextImpl(this);
    }

    @Override
    protected void receive(Message message) {
        handler.receive(message, context);
    }

    @Override
    protected void preStart() {
        handler.preStart(context);
    }

    @Override
    protected void postStop() {
        super.postStop();
        handler.postStop(context);
    }

    @Override
    protected void onError(Message message, Throwable exception) {
        handler.onError(message, exception, context);
    }

    public Handler<Message> getHandler() {
        return handler;
    }
}
