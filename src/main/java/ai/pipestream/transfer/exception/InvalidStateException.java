package ai.pipestream.transfer.exception;

import ai.pipestream.transfer.session.SessionState;

/**
 * Thrown when an operation is not allowed in the session's current state,
 * including attempts to move a session backwards.
 */
public class InvalidStateException extends TransferServiceException {

    private final SessionState state;

    public InvalidStateException(String operation, String sessionId, SessionState state, String details) {
        super("INVALID_STATE", operation,
            String.format("Session %s is %s: %s", sessionId, state, details));
        this.state = state;
    }

    public SessionState getState() {
        return state;
    }

    public static InvalidStateException illegalTransition(String sessionId, SessionState from, SessionState to) {
        return new InvalidStateException("transition", sessionId, from,
            String.format("cannot move to %s", to));
    }

    public static InvalidStateException notIngesting(String operation, String sessionId, SessionState state) {
        return new InvalidStateException(operation, sessionId, state, "session no longer accepts chunks");
    }
}
