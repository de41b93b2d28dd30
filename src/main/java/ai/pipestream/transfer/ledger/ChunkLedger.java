package ai.pipestream.transfer.ledger;

import ai.pipestream.transfer.config.TransferConfiguration;
import ai.pipestream.transfer.exception.ChunkConflictException;
import ai.pipestream.transfer.exception.InvalidRequestException;
import ai.pipestream.transfer.metadata.KeyPage;
import ai.pipestream.transfer.metadata.MetadataCodec;
import ai.pipestream.transfer.metadata.MetadataKeys;
import ai.pipestream.transfer.metadata.MetadataStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Idempotent record of which chunks the client has uploaded.
 * <p>
 * A chunk record is created with put-if-absent and only the creating call bumps the session
 * counter, so replays and concurrent duplicates never double count. A record is never
 * overwritten; a second confirmation with another ETag is a conflict.
 */
@ApplicationScoped
public class ChunkLedger {

    private static final Logger LOG = Logger.getLogger(ChunkLedger.class);

    private final MetadataStore store;
    private final MetadataCodec codec;
    private final int pageSize;

    @Inject
    public ChunkLedger(MetadataStore store, MetadataCodec codec, TransferConfiguration config) {
        this(store, codec, config.metadata().pageSize());
    }

    public ChunkLedger(MetadataStore store, MetadataCodec codec, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        this.store = store;
        this.codec = codec;
        this.pageSize = pageSize;
    }

    /**
     * Records a chunk confirmation.
     *
     * @throws ChunkConflictException   (as failure) if the chunk was confirmed with a different ETag
     * @throws InvalidRequestException  if the part number does not match the chunk index
     */
    public Uni<ConfirmResult> confirm(String sessionId, String fileName, int chunkIndex, int partNumber, String eTag) {
        if (chunkIndex < 0) {
            throw InvalidRequestException.invalidField("confirmChunk", "chunkIndex", chunkIndex, "must not be negative");
        }
        if (partNumber != chunkIndex + 1) {
            throw InvalidRequestException.invalidField("confirmChunk", "partNumber", partNumber,
                    "must equal chunkIndex + 1 (" + (chunkIndex + 1) + ")");
        }
        if (eTag == null || normalizeETag(eTag).isEmpty()) {
            throw InvalidRequestException.missingField("confirmChunk", "eTag");
        }

        String key = MetadataKeys.chunk(sessionId, fileName, chunkIndex);
        ChunkRecord record = new ChunkRecord(fileName, chunkIndex, partNumber, eTag, Instant.now());

        return store.putIfAbsent(key, codec.encode(record))
                .onItem().transformToUni(existing -> {
                    if (existing == null) {
                        return store.increment(MetadataKeys.uploadedCount(sessionId), 1)
                                .map(count -> {
                                    LOG.debugf("Chunk confirmed: sessionId=%s, file=%s, index=%d, uploaded=%d",
                                            sessionId, fileName, chunkIndex, count);
                                    return new ConfirmResult(true, count);
                                });
                    }
                    ChunkRecord recorded = codec.decode(existing, ChunkRecord.class);
                    if (!normalizeETag(recorded.eTag()).equals(normalizeETag(eTag))) {
                        LOG.errorf("ETag conflict: sessionId=%s, file=%s, index=%d, recorded=%s, offered=%s",
                                sessionId, fileName, chunkIndex, recorded.eTag(), eTag);
                        return Uni.createFrom().failure(
                                new ChunkConflictException(sessionId, fileName, chunkIndex, recorded.eTag(), eTag));
                    }
                    LOG.debugf("Duplicate chunk confirmation ignored: sessionId=%s, file=%s, index=%d",
                            sessionId, fileName, chunkIndex);
                    return uploadedCount(sessionId).map(count -> new ConfirmResult(false, count));
                });
    }

    /**
     * Lists every confirmed chunk of a file, sorted by part number. Pages through the key listing
     * and reads each page's records in parallel.
     */
    public Uni<List<ChunkRecord>> listConfirmed(String sessionId, String fileName) {
        String prefix = MetadataKeys.chunkPrefix(sessionId, fileName);
        return collect(prefix, null, new ArrayList<>())
                .map(records -> {
                    records.sort(Comparator.comparingInt(ChunkRecord::partNumber));
                    return records;
                });
    }

    public Uni<Long> uploadedCount(String sessionId) {
        return store.get(MetadataKeys.uploadedCount(sessionId))
                .map(value -> value == null ? 0L : Long.parseLong(value));
    }

    /**
     * Deletes every chunk record and the counter of a session.
     */
    public Uni<Void> purge(String sessionId) {
        return purgePage(MetadataKeys.chunkPrefix(sessionId), null)
                .chain(() -> store.delete(MetadataKeys.uploadedCount(sessionId)))
                .invoke(() -> LOG.debugf("Purged chunk ledger: sessionId=%s", sessionId));
    }

    private Uni<List<ChunkRecord>> collect(String prefix, String cursor, List<ChunkRecord> accumulated) {
        return store.list(prefix, cursor, pageSize)
                .onItem().transformToUni(page -> readAll(page)
                        .onItem().transformToUni(records -> {
                            accumulated.addAll(records);
                            if (page.hasMore()) {
                                return collect(prefix, page.nextCursor(), accumulated);
                            }
                            return Uni.createFrom().item(accumulated);
                        }));
    }

    private Uni<List<ChunkRecord>> readAll(KeyPage page) {
        if (page.keys().isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        List<Uni<String>> reads = page.keys().stream().map(store::get).toList();
        return Uni.join().all(reads).andFailFast()
                .map(values -> values.stream()
                        .filter(Objects::nonNull)
                        .map(value -> codec.decode(value, ChunkRecord.class))
                        .toList());
    }

    private Uni<Void> purgePage(String prefix, String cursor) {
        return store.list(prefix, cursor, pageSize)
                .onItem().transformToUni(page -> {
                    if (page.keys().isEmpty()) {
                        return Uni.createFrom().voidItem();
                    }
                    List<Uni<Void>> deletes = page.keys().stream().map(store::delete).toList();
                    Uni<Void> deleted = Uni.join().all(deletes).andFailFast().replaceWithVoid();
                    if (page.hasMore()) {
                        return deleted.chain(() -> purgePage(prefix, page.nextCursor()));
                    }
                    return deleted;
                });
    }

    /**
     * Strips surrounding quotes and whitespace; stores report ETags both quoted and bare.
     */
    static String normalizeETag(String eTag) {
        String trimmed = eTag.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
