package com.pianola.note;

import com.pianola.ActorContext;
import com.pianola.ActorSystem;
import com.pianola.Pid;
import com.pianola.test.AskTestHelper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class NoteProcessorHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @ParameterizedTest
    @CsvSource({
            "69, 440.0",
            "81, 880.0",
            "57, 220.0",
            "60, 261.6255653005986",
            "21, 27.5"
    })
    void frequencyFollowsEqualTemperament(int keyNumber, double expectedHz) {
        assertEquals(expectedHz, NoteFrequency.hz(keyNumber), 1e-9);
    }

    @Test
    void negativeSimulatedWorkIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new NoteProcessorHandler(0, Duration.ofNanos(-1)));
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMockContext {

        @Mock
        private ActorContext context;

        @Test
        void repliesWithResultForTheNote() {
            NoteProcessorHandler handler = new NoteProcessorHandler(3, Duration.ZERO);
            ProcessNoteRequest request = new ProcessNoteRequest("alice", 64, 0.5, 1L);

            handler.receive(request, context);

            ArgumentCaptor<NoteProcessedResult> result = ArgumentCaptor.forClass(NoteProcessedResult.class);
            verify(context).reply(eq(request), result.capture());
            assertEquals(64, result.getValue().keyNumber());
            assertTrue(result.getValue().processed());
            assertEquals(3, result.getValue().workerId());
            assertTrue(result.getValue().processingTimeMicros() >= 0);
        }

        @Test
        void statsReflectProcessedNotes() {
            NoteProcessorHandler handler = new NoteProcessorHandler(1, Duration.ZERO);
            handler.receive(new ProcessNoteRequest("alice", 60, 0.8, 1L), context);
            handler.receive(new ProcessNoteRequest("alice", 81, 0.8, 2L), context);
            WorkerStatsRequest statsRequest = new WorkerStatsRequest();

            handler.receive(statsRequest, context);

            verify(context).reply(statsRequest, new WorkerStats(1, 2, 880.0));
            verify(context, times(2)).reply(any(ProcessNoteRequest.class), any(NoteProcessedResult.class));
        }
    }

    @Nested
    class InActorSystem {

        private ActorSystem system;
        private Pid worker;

        @BeforeEach
        void setUp() {
            system = new ActorSystem();
            worker = system.<NoteProcessorMessage>actorOf(new NoteProcessorHandler(5, Duration.ofNanos(100_000)))
                    .withId("note-processor-5")
                    .spawn();
        }

        @AfterEach
        void tearDown() {
            system.shutdown();
        }

        @Test
        void processesMiddleC() {
            AskTestHelper.askAndAssert(worker, new ProcessNoteRequest("user", 60, 0.8, 0L), result -> {
                assertEquals(60, result.keyNumber());
                assertTrue(result.processed());
                assertEquals(5, result.workerId());
                assertTrue(result.processingTimeMicros() >= 0);
            }, TIMEOUT);
        }

        @Test
        void countsEveryNote() {
            for (int i = 0; i < 20; i++) {
                AskTestHelper.askSuccess(worker, new ProcessNoteRequest("user", 69, 0.8, i), TIMEOUT);
            }

            WorkerStats stats = AskTestHelper.askSuccess(worker, new WorkerStatsRequest(), TIMEOUT);
            assertEquals(5, stats.workerId());
            assertEquals(20, stats.processedCount());
            assertEquals(440.0, stats.lastFrequencyHz(), 1e-9);
        }
    }
}
