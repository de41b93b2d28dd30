package ai.pipestream.transfer.session;

import ai.pipestream.transfer.archive.ArchiveJob;
import ai.pipestream.transfer.archive.ArchiveProgress;
import ai.pipestream.transfer.archive.ArchiveRecord;
import ai.pipestream.transfer.archive.ArchiveSource;
import ai.pipestream.transfer.archive.StreamingArchiveBuilder;
import ai.pipestream.transfer.config.S3Config;
import ai.pipestream.transfer.config.TransferConfiguration;
import ai.pipestream.transfer.exception.ChunkConflictException;
import ai.pipestream.transfer.exception.IncompleteUploadException;
import ai.pipestream.transfer.exception.InvalidCredentialException;
import ai.pipestream.transfer.exception.InvalidRequestException;
import ai.pipestream.transfer.exception.InvalidStateException;
import ai.pipestream.transfer.exception.NoFilesException;
import ai.pipestream.transfer.exception.SessionNotFoundException;
import ai.pipestream.transfer.ledger.ChunkLedger;
import ai.pipestream.transfer.ledger.ChunkRecord;
import ai.pipestream.transfer.metadata.MetadataCodec;
import ai.pipestream.transfer.metadata.MetadataKeys;
import ai.pipestream.transfer.metadata.MetadataStore;
import ai.pipestream.transfer.observability.TransferObserver;
import ai.pipestream.transfer.spi.CredentialVerifier;
import ai.pipestream.transfer.spi.ExpiryPolicy;
import ai.pipestream.transfer.storage.CompletedPartRef;
import ai.pipestream.transfer.storage.MultipartStorageClient;
import ai.pipestream.transfer.storage.PartUploadDescriptor;
import ai.pipestream.transfer.util.TransferIdGenerator;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives an upload session from init to a published archive.
 * <p>
 * {@code INGESTING -> SEALED -> ARCHIVING -> DONE}, or {@code FAILED} from any non-terminal state.
 * Chunks go straight from the client to the object store; this class only hands out part URLs,
 * records confirmations, and performs the irrevocable steps when the client explicitly completes.
 */
@ApplicationScoped
public class UploadSessionManager {

    private static final Logger LOG = Logger.getLogger(UploadSessionManager.class);

    private final MultipartStorageClient storage;
    private final ChunkLedger ledger;
    private final UploadSessionStore sessions;
    private final StreamingArchiveBuilder archiveBuilder;
    private final MetadataStore metadata;
    private final MetadataCodec codec;
    private final CredentialVerifier credentials;
    private final ExpiryPolicy expiry;
    private final TransferIdGenerator ids;
    private final TransferObserver observer;
    private final SessionSettings settings;

    @Inject
    public UploadSessionManager(MultipartStorageClient storage,
                                ChunkLedger ledger,
                                UploadSessionStore sessions,
                                StreamingArchiveBuilder archiveBuilder,
                                MetadataStore metadata,
                                MetadataCodec codec,
                                CredentialVerifier credentials,
                                ExpiryPolicy expiry,
                                TransferIdGenerator ids,
                                TransferObserver observer,
                                S3Config s3Config,
                                TransferConfiguration config) {
        this(storage, ledger, sessions, archiveBuilder, metadata, codec, credentials, expiry, ids, observer,
                SessionSettings.from(s3Config, config.upload()));
    }

    public UploadSessionManager(MultipartStorageClient storage,
                                ChunkLedger ledger,
                                UploadSessionStore sessions,
                                StreamingArchiveBuilder archiveBuilder,
                                MetadataStore metadata,
                                MetadataCodec codec,
                                CredentialVerifier credentials,
                                ExpiryPolicy expiry,
                                TransferIdGenerator ids,
                                TransferObserver observer,
                                SessionSettings settings) {
        this.storage = storage;
        this.ledger = ledger;
        this.sessions = sessions;
        this.archiveBuilder = archiveBuilder;
        this.metadata = metadata;
        this.codec = codec;
        this.credentials = credentials;
        this.expiry = expiry;
        this.ids = ids;
        this.observer = observer != null ? observer : TransferObserver.NOOP;
        this.settings = settings;
    }

    /**
     * Opens a session: one multipart upload per file and a pre-authorized URL per chunk.
     * Input is validated before any remote call.
     */
    public Uni<SessionDescriptor> init(List<FileDeclaration> files, String credential) {
        if (!credentials.isValid(credential)) {
            throw new InvalidCredentialException("init");
        }
        if (files == null || files.isEmpty()) {
            throw new NoFilesException("init");
        }
        validate(files);

        String sessionId = ids.newSessionId();
        boolean passthrough = StreamingArchiveBuilder.isPassthrough(
                files.stream().map(FileDeclaration::name).toList());
        List<SourceFileTarget> created = new ArrayList<>();

        Uni<Void> creation = Uni.createFrom().voidItem();
        for (FileDeclaration file : files) {
            String key = settings.sourceKey(sessionId, file.name());
            int totalChunks = Math.toIntExact(SourceFileTarget.chunkCount(file.size(), settings.chunkSize()));
            creation = creation.chain(() -> storage.createMultipart(key)
                    .invoke(multipartId -> created.add(new SourceFileTarget(file.name(), file.size(), key,
                            multipartId, settings.chunkSize(), totalChunks, false))))
                    .replaceWithVoid();
        }

        // Presign every part before the session record exists.
        return creation
                .onItem().transformToUni(ignored -> {
                    UploadSession session = new UploadSession(sessionId, credentials.hash(credential), created,
                            SessionState.INGESTING, Instant.now(), null, null, null, passthrough);
                    return describe(session)
                            .onItem().transformToUni(descriptor -> sessions.create(session).replaceWith(descriptor));
                })
                .onFailure().call(error -> abortAll(sessionId, created))
                .invoke(descriptor -> {
                    long totalChunks = descriptor.files().stream().mapToLong(FileUploadPlan::totalChunks).sum();
                    LOG.infof("Session initiated: sessionId=%s, files=%d, chunks=%d, passthrough=%s",
                            sessionId, files.size(), totalChunks, passthrough);
                    observer.sessionInitiated(sessionId, files.size(), totalChunks);
                });
    }

    /**
     * Records that the client uploaded one chunk. Repeating a confirmation is harmless; a
     * conflicting ETag fails the session.
     */
    public Uni<ChunkProgress> confirmChunk(String sessionId, String fileName, int chunkIndex, int partNumber, String eTag) {
        return sessions.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.state() != SessionState.INGESTING) {
                        throw InvalidStateException.notIngesting("confirmChunk", sessionId, session.state());
                    }
                    SourceFileTarget file = session.file(fileName)
                            .orElseThrow(() -> SessionNotFoundException.fileNotInSession("confirmChunk", sessionId, fileName));
                    if (chunkIndex < 0 || chunkIndex >= file.totalChunks()) {
                        throw InvalidRequestException.invalidField("confirmChunk", "chunkIndex", chunkIndex,
                                "must be between 0 and " + (file.totalChunks() - 1));
                    }
                    long total = session.totalChunks();
                    return ledger.confirm(sessionId, fileName, chunkIndex, partNumber, eTag)
                            .map(result -> new ChunkProgress(result.uploadedCount(), total, result.newChunk(),
                                    percent(result.uploadedCount(), total)))
                            .invoke(progress -> observer.chunkConfirmed(sessionId, progress.newChunk()))
                            .onFailure(ChunkConflictException.class)
                            .call(error -> markFailed(sessionId, error.getMessage()));
                });
    }

    /**
     * Verifies that every chunk of every file was confirmed, completes the source multipart
     * uploads and seals the session. Safe to retry after a partial failure; already completed
     * files are skipped. On a session that is already past sealing this returns it unchanged.
     *
     * @throws IncompleteUploadException (as failure) naming the missing chunks; the session keeps ingesting
     */
    public Uni<UploadSession> seal(String sessionId) {
        return sessions.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.state() == SessionState.FAILED) {
                        throw new InvalidStateException("seal", sessionId, SessionState.FAILED,
                                String.valueOf(session.error()));
                    }
                    if (session.state() != SessionState.INGESTING) {
                        return Uni.createFrom().item(session);
                    }
                    return verifyAndSeal(session);
                });
    }

    /**
     * Seals the session and starts the archive build in the background.
     *
     * @return ARCHIVING when this call started the build, otherwise the session's current state
     */
    public Uni<CompletionStatus> complete(String sessionId) {
        return seal(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.state() != SessionState.SEALED) {
                        return Uni.createFrom().item(new CompletionStatus(session.state(), session.archiveId()));
                    }
                    return sessions.update(sessionId,
                                    s -> s.state() == SessionState.SEALED ? s.archiving() : s)
                            .map(transition -> {
                                UploadSession after = transition.after();
                                if (transition.before().state() == SessionState.SEALED
                                        && after.state() == SessionState.ARCHIVING) {
                                    launchArchive(after);
                                }
                                return new CompletionStatus(after.state(), after.archiveId());
                            });
                });
    }

    /**
     * Builds the archive of a session in ARCHIVING state and records the outcome.
     *
     * @return the session in its final state
     */
    public Uni<UploadSession> archive(String sessionId) {
        return sessions.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.state() != SessionState.ARCHIVING) {
                        throw new InvalidStateException("archive", sessionId, session.state(), "session is not archiving");
                    }
                    return runArchive(session);
                });
    }

    /**
     * Reports the session's state and progress.
     */
    public Uni<SessionStatus> status(String sessionId) {
        return sessions.load(sessionId)
                .onItem().transformToUni(session -> {
                    long total = session.totalChunks();
                    return switch (session.state()) {
                        case INGESTING -> ledger.uploadedCount(sessionId)
                                .map(count -> new SessionStatus(SessionState.INGESTING, percent(count, total),
                                        count, total, null, null, null));
                        case SEALED -> Uni.createFrom().item(
                                new SessionStatus(SessionState.SEALED, 0, total, total, null, null, null));
                        case ARCHIVING -> metadata.get(MetadataKeys.archiveProgress(sessionId))
                                .map(raw -> {
                                    ArchiveProgress progress = codec.decode(raw, ArchiveProgress.class);
                                    return new SessionStatus(SessionState.ARCHIVING,
                                            progress != null ? progress.percent() : 0, total, total, null, null,
                                            progress != null ? progress.currentFile() : null);
                                });
                        case DONE -> Uni.createFrom().item(
                                new SessionStatus(SessionState.DONE, 100, total, total, session.archiveId(), null, null));
                        case FAILED -> Uni.createFrom().item(
                                new SessionStatus(SessionState.FAILED, 0, 0, total, null, session.error(), null));
                    };
                });
    }

    private void validate(List<FileDeclaration> files) {
        if (files.size() > settings.maxFiles()) {
            throw InvalidRequestException.invalidField("init", "files", files.size(),
                    "at most " + settings.maxFiles() + " files per session");
        }
        Set<String> names = new HashSet<>();
        for (FileDeclaration file : files) {
            if (file == null || file.name() == null || file.name().isBlank()) {
                throw InvalidRequestException.missingField("init", "files[].name");
            }
            String name = file.name();
            if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
                throw InvalidRequestException.invalidField("init", "files[].name", name, "must be a plain file name");
            }
            if (!names.add(name)) {
                throw InvalidRequestException.invalidField("init", "files[].name", name, "duplicate file name");
            }
            if (file.size() < 0) {
                throw InvalidRequestException.invalidField("init", "files[].size", file.size(), "must not be negative");
            }
            long chunks = SourceFileTarget.chunkCount(file.size(), settings.chunkSize());
            if (chunks > SessionSettings.MAX_PARTS) {
                throw InvalidRequestException.invalidField("init", "files[].size", file.size(),
                        "needs " + chunks + " chunks, at most " + SessionSettings.MAX_PARTS + " allowed");
            }
        }
    }

    private Uni<SessionDescriptor> describe(UploadSession session) {
        List<Uni<FileUploadPlan>> plans = new ArrayList<>();
        for (SourceFileTarget file : session.files()) {
            List<Uni<PartUploadDescriptor>> parts = new ArrayList<>(file.totalChunks());
            for (int partNumber = 1; partNumber <= file.totalChunks(); partNumber++) {
                parts.add(storage.authorizePartUpload(file.storageKey(), file.multipartId(), partNumber));
            }
            plans.add(Uni.join().all(parts).andFailFast()
                    .map(descriptors -> new FileUploadPlan(file.name(), file.declaredSize(), file.totalChunks(),
                            file.multipartId(), descriptors)));
        }
        return Uni.join().all(plans).andFailFast()
                .map(files -> new SessionDescriptor(session.id(), settings.chunkSize(), session.passthrough(), files));
    }

    private Uni<Void> abortAll(String sessionId, List<SourceFileTarget> created) {
        if (created.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        LOG.warnf("Init failed for session %s, aborting %d multipart upload(s)", sessionId, created.size());
        List<Uni<Void>> aborts = created.stream()
                .map(target -> storage.abortMultipart(target.storageKey(), target.multipartId()))
                .toList();
        return Uni.join().all(aborts).andCollectFailures().replaceWithVoid();
    }

    private Uni<UploadSession> verifyAndSeal(UploadSession session) {
        String sessionId = session.id();
        List<Uni<List<ChunkRecord>>> listings = session.files().stream()
                .map(file -> ledger.listConfirmed(sessionId, file.name()))
                .toList();

        return Uni.join().all(listings).andFailFast()
                .onItem().transformToUni(confirmed -> {
                    Map<String, List<Integer>> missing = new LinkedHashMap<>();
                    for (int i = 0; i < session.files().size(); i++) {
                        SourceFileTarget file = session.files().get(i);
                        List<Integer> gaps = missingIndices(file, confirmed.get(i));
                        if (!gaps.isEmpty()) {
                            missing.put(file.name(), gaps);
                        }
                    }
                    if (!missing.isEmpty()) {
                        LOG.infof("Seal rejected for session %s: %d file(s) incomplete", sessionId, missing.size());
                        throw new IncompleteUploadException(sessionId, missing);
                    }
                    return completeSources(session, confirmed);
                })
                .onItem().transformToUni(ignored -> sessions.update(sessionId,
                        s -> s.state() == SessionState.INGESTING ? s.sealed(Instant.now()) : s))
                .map(transition -> {
                    UploadSession after = transition.after();
                    if (after.state() == SessionState.FAILED) {
                        throw new InvalidStateException("seal", sessionId, SessionState.FAILED, String.valueOf(after.error()));
                    }
                    if (transition.changedState()) {
                        observer.sessionSealed(sessionId);
                    }
                    return after;
                });
    }

    static List<Integer> missingIndices(SourceFileTarget file, List<ChunkRecord> confirmed) {
        BitSet present = new BitSet(file.totalChunks());
        for (ChunkRecord record : confirmed) {
            if (record.chunkIndex() >= 0 && record.chunkIndex() < file.totalChunks()) {
                present.set(record.chunkIndex());
            }
        }
        List<Integer> missing = new ArrayList<>();
        for (int index = present.nextClearBit(0); index < file.totalChunks(); index = present.nextClearBit(index + 1)) {
            missing.add(index);
        }
        return missing;
    }

    private Uni<Void> completeSources(UploadSession session, List<List<ChunkRecord>> confirmed) {
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (int i = 0; i < session.files().size(); i++) {
            SourceFileTarget file = session.files().get(i);
            if (file.remoteCompleted()) {
                LOG.debugf("Source already completed, skipping: sessionId=%s, file=%s", session.id(), file.name());
                continue;
            }
            List<CompletedPartRef> parts = confirmed.get(i).stream()
                    .map(record -> new CompletedPartRef(record.partNumber(), record.eTag()))
                    .collect(Collectors.toList());
            chain = chain
                    .chain(() -> storage.completeMultipart(file.storageKey(), file.multipartId(), parts))
                    .chain(() -> sessions.update(session.id(), s -> s.file(file.name())
                            .map(current -> s.withFile(current.withRemoteCompleted()))
                            .orElse(s)))
                    .invoke(() -> LOG.debugf("Source completed: sessionId=%s, file=%s, parts=%d",
                            session.id(), file.name(), parts.size()))
                    .replaceWithVoid();
        }
        return chain;
    }

    private void launchArchive(UploadSession session) {
        runArchive(session).subscribe().with(
                done -> LOG.debugf("Archive task finished: sessionId=%s, state=%s", session.id(), done.state()),
                failure -> LOG.errorf(failure, "Archive task failed: sessionId=%s", session.id()));
    }

    private Uni<UploadSession> runArchive(UploadSession session) {
        String sessionId = session.id();
        String archiveId = ids.newArchiveId();
        List<ArchiveSource> sources = session.files().stream()
                .map(file -> new ArchiveSource(file.name(), file.storageKey()))
                .toList();
        ArchiveJob job = new ArchiveJob(sessionId, archiveId, sources, session.createdAt(), session.passthrough());
        long started = System.nanoTime();

        return archiveBuilder.build(job)
                .onItem().transformToUni(result -> {
                    Instant now = Instant.now();
                    ArchiveRecord record = new ArchiveRecord(archiveId, result.storageKey(), result.fileName(),
                            result.sizeBytes(), result.fileCount(), session.credentialHash(), now, expiry.expiresAt(now));
                    return metadata.put(MetadataKeys.archive(archiveId), codec.encode(record))
                            .chain(() -> sessions.update(sessionId, s -> s.done(archiveId)))
                            .invoke(() -> observer.archiveCompleted(sessionId, result.sizeBytes(),
                                    Duration.ofNanos(System.nanoTime() - started)));
                })
                .map(UploadSessionStore.Transition::after)
                .call(done -> cleanup(sessionId))
                .invoke(done -> LOG.infof("Session %s done: archiveId=%s", sessionId, done.archiveId()))
                .onFailure().recoverWithUni(error -> {
                    observer.archiveFailed(sessionId, error);
                    return markFailed(sessionId, error.getMessage())
                            .onItem().transformToUni(ignored -> Uni.createFrom().<UploadSession>failure(error));
                });
    }

    private Uni<Void> cleanup(String sessionId) {
        return ledger.purge(sessionId)
                .chain(() -> metadata.delete(MetadataKeys.archiveProgress(sessionId)))
                .onFailure().recoverWithItem(e -> {
                    LOG.warnf("Failed to clean up ledger of session %s: %s", sessionId, e.getMessage());
                    return null;
                });
    }

    private Uni<UploadSession> markFailed(String sessionId, String reason) {
        return sessions.update(sessionId, s -> s.state().isTerminal() ? s : s.failed(reason))
                .map(UploadSessionStore.Transition::after)
                .invoke(s -> LOG.warnf("Session %s failed: %s", sessionId, reason))
                .onFailure().recoverWithItem(e -> {
                    LOG.errorf("Could not mark session %s as failed: %s", sessionId, e.getMessage());
                    return null;
                });
    }

    static int percent(long uploaded, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100L, uploaded * 100 / total);
    }
}
