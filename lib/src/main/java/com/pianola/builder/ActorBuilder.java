package com.pianola.builder;

import com.pianola.ActorException;
import com.pianola.ActorSystem;
import com.pianola.Pid;
import com.pianola.SupervisionStrategy;
import com.pianola.config.ThreadPoolFactory;
import com.pianola.handler.Handler;
import com.pianola.internal.HandlerActor;
import com.pianola.mailbox.config.MailboxConfig;

/**
 * Builder for creating actors with a fluent API.
 *
 * @param <Message> The type of messages this actor processes
 */
public class ActorBuilder<Message> {
    private final ActorSystem system;
    private final Handler<Message> handler;
    private String id;
    private MailboxConfig mailboxConfig;
    private SupervisionStrategy supervisionStrategy;
    private ThreadPoolFactory threadPoolFactory;

    /**
     * Creates a new ActorBuilder with the specified system and handler.
     *
     * @param system  The actor system
     * @param handler The handler to delegate to
     */
    public ActorBuilder(ActorSystem system, Handler<Message> handler) {
        this.system = system;
        this.handler = handler;
    }

    /**
     * Sets the ID for the actor. Without it a unique id is generated from the handler class.
     *
     * @param id The ID for the actor
     * @return This builder for method chaining
     */
    public ActorBuilder<Message> withId(String id) {
        this.id = id;
        return this;
    }

    /**
     * Sets the mailbox configuration for the actor.
     * If not specified, the system's mailbox configuration is used.
     *
     * @param mailboxConfig The mailbox configuration
     * @return This builder for method chaining
     */
    public ActorBuilder<Message> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig;
        return this;
    }

    /**
     * Sets the supervision strategy for the actor.
     *
     * @param supervisionStrategy The supervision strategy to use
     * @return This builder for method chaining
     */
    public ActorBuilder<Message> withSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = supervisionStrategy;
        return this;
    }

    /**
     * Sets the thread pool factory for the actor.
     * If not specified, the system's thread pool factory is used.
     *
     * @param threadPoolFactory The thread pool factory to use
     * @return This builder for method chaining
     */
    public ActorBuilder<Message> withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    /**
     * Creates, registers and starts the actor. Returns once the handler's
     * {@code preStart} has run on the actor thread.
     *
     * @return The PID of the created actor
     * @throws ActorException if the id is taken or the actor fails to start
     */
    public Pid spawn() {
        String finalId = id != null
                ? id
                : system.generateActorId(handler.getClass().getSimpleName().toLowerCase());
        ThreadPoolFactory tpfToUse = threadPoolFactory != null ? threadPoolFactory : system.getThreadPoolFactory();
        MailboxConfig mbConfigToUse = mailboxConfig != null ? mailboxConfig : system.getMailboxConfig();

        HandlerActor<Message> actor = new HandlerActor<>(
                system,
                finalId,
                handler,
                mbConfigToUse,
                tpfToUse,
                system.getMailboxProvider());
        if (supervisionStrategy != null) {
            actor.withSupervisionStrategy(supervisionStrategy);
        }

        system.registerActor(actor);
        try {
            actor.start();
        } catch (ActorException e) {
            system.shutdown(finalId);
            throw e;
        }
        return actor.self();
    }
}
