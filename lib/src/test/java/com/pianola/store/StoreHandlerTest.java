package com.pianola.store;

import com.pianola.ActorSystem;
import com.pianola.HandlerException;
import com.pianola.Pid;
import com.pianola.Reply;
import com.pianola.config.ThreadPoolFactory;
import com.pianola.test.AskTestHelper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private NoteStoreConnector connector;

    @Mock
    private NoteStoreConnection connection;

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    private Pid spawnStore(NoteStoreConnector storeConnector) {
        return system.<StoreMessage>actorOf(new StoreHandler(storeConnector))
                .withId("note-store")
                .spawn();
    }

    @Test
    void failedConnectKeepsActorUpWithoutConnection() {
        IllegalStateException refused = new IllegalStateException("connection refused");
        when(connector.connect()).thenThrow(refused);
        Pid store = spawnStore(connector);

        HandlerException error = AskTestHelper.askHandlerFailure(store, new GetUserNotesRequest("alice", 10), TIMEOUT);

        assertInstanceOf(StoreUnavailableException.class, error);
        assertEquals(HandlerException.Code.STORE_UNAVAILABLE, error.getCode());
        assertSame(refused, error.getCause());
        assertEquals(new StoreStatus(false, 0, 0), AskTestHelper.askSuccess(store, new StoreStatusRequest(), TIMEOUT));
        assertTrue(system.getActor(store).isRunning());
    }

    @Test
    void everyDataRequestFailsWithoutConnection() {
        when(connector.connect()).thenThrow(new IllegalStateException("connection refused"));
        Pid store = spawnStore(connector);

        assertEquals(HandlerException.Code.STORE_UNAVAILABLE, AskTestHelper.askHandlerFailure(store,
                new SaveSongRequest("alice", "tune", List.of(60, 62)), TIMEOUT).getCode());
        assertEquals(HandlerException.Code.STORE_UNAVAILABLE, AskTestHelper.askHandlerFailure(store,
                new RecordNoteRequest("alice", 60, 0.8, 1L), TIMEOUT).getCode());
    }

    @Test
    void readsNotesThroughConnection() {
        List<NoteEvent> notes = List.of(new NoteEvent("alice", 64, 0.8, 2L), new NoteEvent("alice", 60, 0.8, 1L));
        when(connector.connect()).thenReturn(connection);
        when(connection.recentNotes("alice", 2)).thenReturn(notes);
        Pid store = spawnStore(connector);

        assertEquals(notes, AskTestHelper.askSuccess(store, new GetUserNotesRequest("alice", 2), TIMEOUT));
    }

    @Test
    void nonPositiveLimitReturnsEmptyWithoutQuerying() {
        when(connector.connect()).thenReturn(connection);
        Pid store = spawnStore(connector);

        assertEquals(List.of(), AskTestHelper.askSuccess(store, new GetUserNotesRequest("alice", 0), TIMEOUT));
        assertEquals(List.of(), AskTestHelper.askSuccess(store, new GetUserNotesRequest("alice", -5), TIMEOUT));
        verify(connection, never()).recentNotes(anyString(), anyInt());
    }

    @Test
    void connectionErrorBecomesUnexpectedHandlerFailure() {
        when(connector.connect()).thenReturn(connection);
        when(connection.saveSong("alice", "tune", List.of(60))).thenThrow(new IllegalStateException("disk full"));
        Pid store = spawnStore(connector);

        HandlerException error = AskTestHelper.askHandlerFailure(store, new SaveSongRequest("alice", "tune", List.of(60)), TIMEOUT);

        assertEquals(HandlerException.Code.UNEXPECTED, error.getCode());
        assertTrue(system.getActor(store).isRunning());
    }

    @Test
    void stoppingTheActorClosesTheConnection() {
        when(connector.connect()).thenReturn(connection);
        Pid store = spawnStore(connector);

        system.stopActor(store);

        verify(connection).close();
        verify(connector).connect();
    }

    @Test
    void connectionStaysOpenUntilTheRequestInFlightFinishes() throws InterruptedException {
        ActorSystem impatient = new ActorSystem(new ThreadPoolFactory().setActorShutdownTimeoutSeconds(1));
        CountDownLatch reading = new CountDownLatch(1);
        AtomicBoolean closed = new AtomicBoolean();
        AtomicBoolean closedDuringRead = new AtomicBoolean();
        List<NoteEvent> notes = List.of(new NoteEvent("alice", 60, 0.8, 1L));
        when(connector.connect()).thenReturn(connection);
        when(connection.recentNotes("alice", 1)).thenAnswer(invocation -> {
            reading.countDown();
            // a blocking driver call that does not react to interrupts
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(2000);
            while (System.nanoTime() < deadline) {
                LockSupport.parkNanos(deadline - System.nanoTime());
            }
            closedDuringRead.set(closed.get());
            return notes;
        });
        doAnswer(invocation -> {
            closed.set(true);
            return null;
        }).when(connection).close();
        try {
            Pid store = impatient.<StoreMessage>actorOf(new StoreHandler(connector)).withId("note-store").spawn();
            Reply<List<NoteEvent>> read = store.ask(new GetUserNotesRequest("alice", 1), TIMEOUT);
            assertTrue(reading.await(5, TimeUnit.SECONDS));

            impatient.stopActor(store);

            assertEquals(notes, read.get());
            verify(connection, timeout(5_000)).close();
            assertFalse(closedDuringRead.get());
        } finally {
            impatient.shutdown();
        }
    }

    @Test
    void songIdsIncreaseWithEverySave() {
        Pid store = spawnStore(new InMemoryNoteStore());

        SongSavedResult first = AskTestHelper.askSuccess(store, new SaveSongRequest("alice", "one", List.of(60)), TIMEOUT);
        SongSavedResult second = AskTestHelper.askSuccess(store, new SaveSongRequest("bob", "two", List.of(62, 64)), TIMEOUT);

        assertTrue(first.saved());
        assertTrue(second.saved());
        assertTrue(second.songId() > first.songId());
        assertEquals(new StoreStatus(true, 2, 0), AskTestHelper.askSuccess(store, new StoreStatusRequest(), TIMEOUT));
    }

    @Test
    void outOfRangeNoteIsAnInvalidRequest() {
        Pid store = spawnStore(new InMemoryNoteStore());

        HandlerException error = AskTestHelper.askHandlerFailure(store,
                new RecordNoteRequest("alice", 200, 0.8, 1L), TIMEOUT);

        assertEquals(HandlerException.Code.INVALID_REQUEST, error.getCode());
        assertEquals(new StoreStatus(true, 0, 0), AskTestHelper.askSuccess(store, new StoreStatusRequest(), TIMEOUT));
    }

    @Test
    void recordedNotesComeBackNewestFirst() {
        Pid store = spawnStore(new InMemoryNoteStore());
        for (long ts = 1; ts <= 5; ts++) {
            AskTestHelper.askSuccess(store, new RecordNoteRequest("alice", 59 + (int) ts, 0.8, ts * 100), TIMEOUT);
        }
        AskTestHelper.askSuccess(store, new RecordNoteRequest("bob", 70, 0.8, 1_000), TIMEOUT);

        List<NoteEvent> recent = AskTestHelper.askSuccess(store, new GetUserNotesRequest("alice", 3), TIMEOUT);

        assertEquals(List.of(500L, 400L, 300L), recent.stream().map(NoteEvent::timestamp).toList());
        assertTrue(recent.stream().allMatch(event -> event.userId().equals("alice")));
    }
}
