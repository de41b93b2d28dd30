package ai.pipestream.transfer.session;

import ai.pipestream.transfer.exception.InvalidStateException;
import ai.pipestream.transfer.exception.SessionNotFoundException;
import ai.pipestream.transfer.metadata.MetadataCodec;
import ai.pipestream.transfer.metadata.MetadataKeys;
import ai.pipestream.transfer.metadata.MetadataStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.function.UnaryOperator;

/**
 * Reads and writes upload sessions. Every update is a compare-and-set on the session key;
 * a stale write is re-read, re-applied and re-validated.
 */
@ApplicationScoped
public class UploadSessionStore {

    private static final Logger LOG = Logger.getLogger(UploadSessionStore.class);

    static final int MAX_UPDATE_ATTEMPTS = 32;

    /**
     * A successful update: the session as read and as written.
     */
    public record Transition(UploadSession before, UploadSession after) {

        public boolean changedState() {
            return before.state() != after.state();
        }
    }

    private final MetadataStore store;
    private final MetadataCodec codec;

    @Inject
    public UploadSessionStore(MetadataStore store, MetadataCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * Stores a new session. Fails if the id is already taken.
     */
    public Uni<UploadSession> create(UploadSession session) {
        return store.putIfAbsent(MetadataKeys.session(session.id()), codec.encode(session))
                .map(existing -> {
                    if (existing != null) {
                        throw new IllegalStateException("Session id collision: " + session.id());
                    }
                    LOG.debugf("Created session: sessionId=%s, files=%d", session.id(), session.files().size());
                    return session;
                });
    }

    /**
     * @throws SessionNotFoundException (as failure) if no such session exists
     */
    public Uni<UploadSession> load(String sessionId) {
        return store.get(MetadataKeys.session(sessionId))
                .map(raw -> {
                    if (raw == null) {
                        throw new SessionNotFoundException("load", sessionId);
                    }
                    return codec.decode(raw, UploadSession.class);
                });
    }

    /**
     * Applies a mutation with compare-and-set. The mutation may be applied several times and must
     * be free of side effects; returning the input unchanged skips the write.
     *
     * @throws InvalidStateException (as failure) if the mutation moves the state backwards
     */
    public Uni<Transition> update(String sessionId, UnaryOperator<UploadSession> mutation) {
        return attemptUpdate(sessionId, mutation, 1);
    }

    private Uni<Transition> attemptUpdate(String sessionId, UnaryOperator<UploadSession> mutation, int attempt) {
        String key = MetadataKeys.session(sessionId);
        return store.get(key)
                .onItem().transformToUni(raw -> {
                    if (raw == null) {
                        throw new SessionNotFoundException("update", sessionId);
                    }
                    UploadSession before = codec.decode(raw, UploadSession.class);
                    UploadSession after = mutation.apply(before);
                    if (after.equals(before)) {
                        return Uni.createFrom().item(new Transition(before, before));
                    }
                    if (after.state() != before.state() && !before.state().canTransitionTo(after.state())) {
                        throw InvalidStateException.illegalTransition(sessionId, before.state(), after.state());
                    }
                    return store.replace(key, raw, codec.encode(after))
                            .onItem().transformToUni(replaced -> {
                                if (replaced) {
                                    if (before.state() != after.state()) {
                                        LOG.infof("Session %s: %s -> %s", sessionId, before.state(), after.state());
                                    }
                                    return Uni.createFrom().item(new Transition(before, after));
                                }
                                if (attempt >= MAX_UPDATE_ATTEMPTS) {
                                    return Uni.createFrom().failure(new IllegalStateException(
                                            "Session " + sessionId + " kept changing during update"));
                                }
                                LOG.debugf("Stale session write, retrying: sessionId=%s, attempt=%d", sessionId, attempt);
                                return attemptUpdate(sessionId, mutation, attempt + 1);
                            });
                });
    }
}
