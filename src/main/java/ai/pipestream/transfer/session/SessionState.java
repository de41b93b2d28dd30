package ai.pipestream.transfer.session;

/**
 * Lifecycle of an upload session. Transitions only move forward;
 * {@link #FAILED} is reachable from every non-terminal state.
 */
public enum SessionState {
    INGESTING,
    SEALED,
    ARCHIVING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(SessionState next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case INGESTING -> next == SEALED;
            case SEALED -> next == ARCHIVING;
            case ARCHIVING -> next == DONE;
            case DONE, FAILED -> false;
        };
    }
}
