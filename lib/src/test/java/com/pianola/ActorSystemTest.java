package com.pianola;

import com.pianola.handler.Handler;
import com.pianola.helper.GateProtocol.Echo;
import com.pianola.helper.GateProtocol.GateHandler;
import com.pianola.test.AskTestHelper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ActorSystemTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        if (system != null) {
            system.shutdown();
        }
        system = null;
    }

    @Test
    void spawnedActorIsRegisteredUnderItsId() {
        Pid pid = system.actorOf(new GateHandler()).withId("gate").spawn();

        assertEquals("gate", pid.actorId());
        assertNotNull(system.getActor(pid));
        assertTrue(system.getActorOptional(pid).isPresent());
        assertEquals("gate@local", pid.toString());
    }

    @Test
    void generatedIdsAreUnique() {
        Pid first = system.actorOf(new GateHandler()).spawn();
        Pid second = system.actorOf(new GateHandler()).spawn();

        assertNotEquals(first.actorId(), second.actorId());
        assertTrue(first.actorId().startsWith("gatehandler-"));
    }

    @Test
    void duplicateIdIsRejected() {
        system.actorOf(new GateHandler()).withId("gate").spawn();

        ActorException error = assertThrows(ActorException.class,
                () -> system.actorOf(new GateHandler()).withId("gate").spawn());
        assertEquals("gate", error.getActorId());
    }

    @Test
    void failingPreStartAbortsSpawn() {
        Handler<Object> broken = new Handler<>() {
            @Override
            public void receive(Object message, ActorContext context) {
            }

            @Override
            public void preStart(ActorContext context) {
                throw new IllegalStateException("cannot start");
            }
        };

        ActorException error = assertThrows(ActorException.class,
                () -> system.actorOf(broken).withId("broken").spawn());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertNull(system.getActor(new Pid("broken", system)));
    }

    @Test
    void shutdownIsIdempotentAndRejectsNewWork() {
        Pid pid = system.actorOf(new GateHandler()).withId("gate").spawn();

        system.shutdown();
        system.shutdown();

        assertTrue(system.isShutdown());
        assertNull(system.getActor(pid));
        assertEquals(TransportException.Kind.SYSTEM_SHUTDOWN,
                AskTestHelper.askTransportFailure(pid, new Echo("x"), TIMEOUT).getKind());
        assertThrows(ActorException.class, () -> system.actorOf(new GateHandler()).withId("late").spawn());
    }

    @Test
    void shutdownOfSingleActorRemovesIt() {
        Pid pid = system.actorOf(new GateHandler()).withId("gate").spawn();

        system.shutdown("gate");

        assertEquals(TransportException.Kind.ACTOR_NOT_FOUND,
                AskTestHelper.askTransportFailure(pid, new Echo("x"), TIMEOUT).getKind());
    }
}
