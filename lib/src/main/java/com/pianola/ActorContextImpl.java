package com.pianola;

import org.slf4j.Logger;

/**
 * Implementation of the ActorContext interface that delegates to an underlying Actor instance.
 */
public class ActorContextImpl implements ActorContext {

    private final Actor<?> actor;

    /**
     * Creates a new ActorContextImpl for the specified actor.
     *
     * @param actor The actor to create a context for
     */
    public ActorContextImpl(Actor<?> actor) {
        this.actor = actor;
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
    public boolean tell(Pid target, Object message) {
        return actor.getSystem().tell(target, message);
    }

    @Override
    public <R> void reply(Request<R> request, R response) {
        actor.reply(request, response);
    }

    @Override
    public boolean isAsk() {
        return actor.isAsk();
    }

    @Override
    public ActorSystem getSystem() {
        return actor.getSystem();
    }

    @Override
    public Logger getLogger() {
        return actor.getLogger();
    }
}
