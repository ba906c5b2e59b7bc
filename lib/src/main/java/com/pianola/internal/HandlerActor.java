package com.pianola.internal;

import com.pianola.Actor;
import com.pianola.ActorContext;
import com.pianola.ActorContextImpl;
import com.pianola.ActorSystem;
import com.pianola.config.ThreadPoolFactory;
import com.pianola.handler.Handler;
import com.pianola.mailbox.config.MailboxConfig;
import com.pianola.mailbox.config.MailboxProvider;

/**
 * Internal implementation of an Actor that delegates to a Handler.
 * This class is not meant to be used directly by users.
 *
 * @param <Message> The type of messages this actor processes
 */
public class HandlerActor<Message> extends Actor<Message> {

    private final Handler<Message> handler;
    private final ActorContext context;

    /**
     * Creates a new HandlerActor with the specified handler.
     *
     * @param system            The actor system
     * @param actorId           The actor ID
     * @param handler           The handler to delegate to
     * @param mailboxConfig     The mailbox configuration
     * @param threadPoolFactory The thread pool factory
     * @param mailboxProvider   The mailbox provider
     */
    public HandlerActor(
            ActorSystem system,
            String actorId,
            Handler<Message> handler,
            MailboxConfig mailboxConfig,
            ThreadPoolFactory threadPoolFactory,
            MailboxProvider<Object> mailboxProvider) {
        super(system, actorId, mailboxConfig, threadPoolFactory, mailboxProvider);
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
        handler.postStop(context);
    }

    @Override
    protected void onError(Message message, RuntimeException exception) {
        handler.onError(message, exception, context);
    }

    public Handler<Message> getHandler() {
        return handler;
    }
}
