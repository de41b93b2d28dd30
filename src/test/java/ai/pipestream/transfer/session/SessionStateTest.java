package ai.pipestream.transfer.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateTest {

    @Test
    void forwardTransitionsAreAllowed() {
        assertTrue(SessionState.INGESTING.canTransitionTo(SessionState.SEALED));
        assertTrue(SessionState.SEALED.canTransitionTo(SessionState.ARCHIVING));
        assertTrue(SessionState.ARCHIVING.canTransitionTo(SessionState.DONE));
    }

    @Test
    void backwardAndSkippingTransitionsAreRejected() {
        assertFalse(SessionState.SEALED.canTransitionTo(SessionState.INGESTING));
        assertFalse(SessionState.ARCHIVING.canTransitionTo(SessionState.SEALED));
        assertFalse(SessionState.INGESTING.canTransitionTo(SessionState.ARCHIVING));
        assertFalse(SessionState.INGESTING.canTransitionTo(SessionState.DONE));
    }

    @Test
    void failedIsReachableOnlyFromNonTerminalStates() {
        assertTrue(SessionState.INGESTING.canTransitionTo(SessionState.FAILED));
        assertTrue(SessionState.SEALED.canTransitionTo(SessionState.FAILED));
        assertTrue(SessionState.ARCHIVING.canTransitionTo(SessionState.FAILED));
        assertFalse(SessionState.DONE.canTransitionTo(SessionState.FAILED));
        assertFalse(SessionState.FAILED.canTransitionTo(SessionState.FAILED));
    }

    @Test
    void terminalStatesAreFinal() {
        for (SessionState next : SessionState.values()) {
            assertFalse(SessionState.DONE.canTransitionTo(next), "DONE -> " + next);
            assertFalse(SessionState.FAILED.canTransitionTo(next), "FAILED -> " + next);
        }
        assertTrue(SessionState.DONE.isTerminal());
        assertTrue(SessionState.FAILED.isTerminal());
        assertFalse(SessionState.ARCHIVING.isTerminal());
    }

    @Test
    void chunkCountRoundsUpAndNeverDropsBelowOne() {
        assertEquals(3L, SourceFileTarget.chunkCount(12_000_000L, 5L * 1024 * 1024));
        assertEquals(2L, SourceFileTarget.chunkCount(2048, 1024));
        assertEquals(1L, SourceFileTarget.chunkCount(1, 1024));
        assertEquals(1L, SourceFileTarget.chunkCount(0, 1024));
    }
}
