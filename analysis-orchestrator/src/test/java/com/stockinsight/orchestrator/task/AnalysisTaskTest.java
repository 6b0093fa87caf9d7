package com.stockinsight.orchestrator.task;

import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.TaskState;
import com.stockinsight.marketdata.symbol.ResolvedSymbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisTaskTest {

    private static final Instant T0 = Instant.parse("2024-06-03T09:30:00Z");

    private static AnalysisTask task() {
        return new AnalysisTask("t1", "c1", new ResolvedSymbol("AAPL", Market.US), true, null, T0);
    }

    @Test
    @DisplayName("moves forward through the pipeline states")
    void forward() {
        AnalysisTask task = task();
        task.advance(TaskState.FETCHING, T0.plusSeconds(1));
        task.advance(TaskState.SCORING, T0.plusSeconds(2));
        task.advance(TaskState.NARRATING, T0.plusSeconds(3));
        assertTrue(task.complete(72.5, T0.plusSeconds(4)));

        assertEquals(TaskState.DONE, task.state());
        assertEquals(72.5, task.composite());
        assertEquals(T0.plusSeconds(4), task.view().updatedAt());
    }

    @Test
    @DisplayName("backward moves are rejected")
    void noBackwardMove() {
        AnalysisTask task = task();
        task.advance(TaskState.SCORING, T0);
        assertThrows(IllegalStateException.class, () -> task.advance(TaskState.FETCHING, T0));
        assertEquals(TaskState.SCORING, task.state());
    }

    @Test
    @DisplayName("the first terminal transition wins")
    void firstTerminalWins() {
        AnalysisTask task = task();
        assertTrue(task.fail(FailureKind.CANCELLED, "Client disconnected", T0));
        assertFalse(task.complete(50, T0));
        assertFalse(task.fail(FailureKind.INTERNAL, "later", T0));
        assertThrows(IllegalStateException.class, () -> task.advance(TaskState.NARRATING, T0));

        TaskView view = task.view();
        assertEquals(TaskState.FAILED, view.state());
        assertEquals(FailureKind.CANCELLED, view.failureKind());
        assertEquals("Client disconnected", view.error());
    }

    @Test
    @DisplayName("cancel completes the cancellation signal")
    void cancelSignal() {
        AnalysisTask task = task();
        task.cancel();
        StepVerifier.create(task.cancellation()).verifyComplete();
    }
}
