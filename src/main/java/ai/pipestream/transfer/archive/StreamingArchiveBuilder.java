package ai.pipestream.transfer.archive;

import ai.pipestream.transfer.config.S3Config;
import ai.pipestream.transfer.config.TransferConfiguration;
import ai.pipestream.transfer.exception.ArchiveBuildException;
import ai.pipestream.transfer.exception.StorageCallException;
import ai.pipestream.transfer.metadata.MetadataCodec;
import ai.pipestream.transfer.metadata.MetadataKeys;
import ai.pipestream.transfer.metadata.MetadataStore;
import ai.pipestream.transfer.observability.TransferObserver;
import ai.pipestream.transfer.storage.CompletedPartRef;
import ai.pipestream.transfer.storage.MultipartStorageClient;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Repacks sealed source objects into a single STORED ZIP archive and republishes it as a
 * multipart upload whose parts all have exactly {@link ArchiveSettings#standardPartSize()} bytes,
 * except the last.
 * <p>
 * The producer reads every source in ranged windows and writes it through {@link StoredZipWriter}
 * into a bounded {@link SliceChannel}. A separate assembler task cuts standard-size parts off the
 * channel and dispatches each upload without waiting for it. All outstanding uploads are joined
 * once, after the central directory, and bounded by the finalize timeout. On any failure the
 * archive's multipart upload is aborted before the error is reported.
 */
@ApplicationScoped
public class StreamingArchiveBuilder {

    private static final Logger LOG = Logger.getLogger(StreamingArchiveBuilder.class);

    private final MultipartStorageClient storage;
    private final MetadataStore store;
    private final MetadataCodec codec;
    private final ArchiveSettings settings;
    private final TransferObserver observer;
    private final Executor executor;

    @Inject
    public StreamingArchiveBuilder(MultipartStorageClient storage,
                                   MetadataStore store,
                                   MetadataCodec codec,
                                   S3Config s3Config,
                                   TransferConfiguration config,
                                   TransferObserver observer) {
        this(storage, store, codec, ArchiveSettings.from(s3Config, config.archive()), observer,
                Infrastructure.getDefaultWorkerPool());
    }

    public StreamingArchiveBuilder(MultipartStorageClient storage,
                                   MetadataStore store,
                                   MetadataCodec codec,
                                   ArchiveSettings settings,
                                   TransferObserver observer,
                                   Executor executor) {
        this.storage = storage;
        this.store = store;
        this.codec = codec;
        this.settings = settings;
        this.observer = observer != null ? observer : TransferObserver.NOOP;
        this.executor = executor;
    }

    public ArchiveSettings settings() {
        return settings;
    }

    /**
     * Builds and publishes the archive. Runs on the worker pool; the returned Uni fails with
     * {@link ArchiveBuildException} after the archive's multipart upload was aborted.
     */
    public Uni<ArchiveResult> build(ArchiveJob job) {
        return Uni.createFrom().item(() -> buildBlocking(job))
                .runSubscriptionOn(executor);
    }

    /**
     * Whether a session's sources are republished unchanged: a single source that already is a ZIP.
     */
    public static boolean isPassthrough(List<String> fileNames) {
        return fileNames.size() == 1 && fileNames.get(0).toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    ArchiveResult buildBlocking(ArchiveJob job) {
        String key = settings.archiveKey(job.archiveId());
        String fileName = job.passthrough() ? job.sources().get(0).name() : settings.archiveName();
        long started = System.currentTimeMillis();
        LOG.infof("Building archive: sessionId=%s, archiveId=%s, sources=%d, passthrough=%s",
                job.sessionId(), job.archiveId(), job.sources().size(), job.passthrough());

        String multipartId = createUpload(job, key);

        SliceChannel channel = new SliceChannel(settings.channelCapacity());
        Queue<CompletableFuture<CompletedPartRef>> uploads = new ConcurrentLinkedQueue<>();
        PartAssembler assembler = new PartAssembler(channel, (int) settings.standardPartSize(),
                (partNumber, bytes) -> uploads.add(dispatch(key, multipartId, partNumber, bytes, channel)));

        CompletableFuture<Integer> consumer = CompletableFuture.supplyAsync(() -> {
            try {
                return assembler.run();
            } catch (IOException e) {
                channel.fail(e);
                throw new IllegalStateException(e.getMessage(), e);
            }
        }, executor);

        try {
            ChannelOutputStream sink = new ChannelOutputStream(channel, settings.sliceSize());
            int fileCount = job.passthrough()
                    ? copyThrough(job, sink, channel)
                    : pack(job, sink, channel);
            sink.close();

            long deadline = System.nanoTime() + settings.finalizeTimeout().toNanos();
            int partCount = awaitUntil(consumer, deadline);
            awaitUntil(CompletableFuture.allOf(uploads.toArray(new CompletableFuture[0])), deadline);
            Throwable failure = channel.failure();
            if (failure != null) {
                throw new IOException(failure.getMessage(), failure);
            }

            List<CompletedPartRef> parts = new ArrayList<>(partCount);
            for (CompletableFuture<CompletedPartRef> upload : uploads) {
                parts.add(upload.join());
            }
            parts.sort(Comparator.comparingInt(CompletedPartRef::partNumber));

            saveProgress(job, new ArchiveProgress(ArchiveProgress.Phase.FINALIZING,
                    job.sources().size(), job.sources().size(), null));
            storage.completeMultipart(key, multipartId, parts).await().indefinitely();

            long size = sink.count();
            LOG.infof("Archive published: sessionId=%s, key=%s, size=%d, parts=%d, duration=%dms",
                    job.sessionId(), key, size, partCount, System.currentTimeMillis() - started);

            deleteSources(job);
            return new ArchiveResult(job.archiveId(), key, fileName, size, fileCount, partCount);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            channel.fail(cause);
            LOG.errorf(cause, "Archive build failed, aborting: sessionId=%s, key=%s", job.sessionId(), key);
            storage.abortMultipart(key, multipartId).await().indefinitely();
            if (cause instanceof TimeoutException) {
                long pending = uploads.stream().filter(upload -> !upload.isDone()).count();
                throw ArchiveBuildException.finalizeTimedOut(job.sessionId(), pending, settings.finalizeTimeout());
            }
            throw ArchiveBuildException.failed(job.sessionId(), cause);
        }
    }

    private int pack(ArchiveJob job, OutputStream sink, SliceChannel channel) throws IOException {
        StoredZipWriter zip = new StoredZipWriter(sink);
        int total = job.sources().size();
        for (int i = 0; i < total; i++) {
            ArchiveSource source = job.sources().get(i);
            saveProgress(job, new ArchiveProgress(ArchiveProgress.Phase.READING, i, total, source.name()));

            SourceContent content = open(source);
            zip.putEntry(source.name(), job.entryTime(), content.size());
            content.copyTo(zip::write, channel);
            zip.closeEntry();
            LOG.debugf("Archived entry: sessionId=%s, name=%s, size=%d", job.sessionId(), source.name(), content.size());
        }
        saveProgress(job, new ArchiveProgress(ArchiveProgress.Phase.READING, total, total, null));
        zip.finish();
        return zip.entryCount();
    }

    private int copyThrough(ArchiveJob job, OutputStream sink, SliceChannel channel) throws IOException {
        ArchiveSource source = job.sources().get(0);
        saveProgress(job, new ArchiveProgress(ArchiveProgress.Phase.READING, 0, 1, source.name()));
        SourceContent content = open(source);
        content.copyTo(sink::write, channel);
        return 1;
    }

    private CompletableFuture<CompletedPartRef> dispatch(String key, String multipartId, int partNumber,
                                                          byte[] bytes, SliceChannel channel) {
        LOG.debugf("Dispatching archive part: key=%s, partNumber=%d, size=%d", key, partNumber, bytes.length);
        CompletableFuture<CompletedPartRef> upload = storage.uploadPart(key, multipartId, partNumber, bytes)
                .map(eTag -> new CompletedPartRef(partNumber, eTag))
                .subscribeAsCompletionStage();
        upload.whenComplete((part, error) -> {
            if (error != null) {
                channel.fail(unwrap(error));
            } else {
                observer.partUploaded(key, partNumber, bytes.length);
            }
        });
        return upload;
    }

    /**
     * Resolves the size of a source with a HEAD request, falling back to reading the whole object.
     */
    private SourceContent open(ArchiveSource source) {
        try {
            long size = storage.headObject(source.storageKey()).await().indefinitely();
            return new SourceContent(source.storageKey(), size, null);
        } catch (StorageCallException e) {
            LOG.warnf("HEAD failed for %s, reading the whole object instead: %s", source.storageKey(), e.getMessage());
            byte[] whole = storage.getObject(source.storageKey()).await().indefinitely();
            return new SourceContent(source.storageKey(), whole.length, whole);
        }
    }

    @FunctionalInterface
    private interface ByteTarget {
        void write(byte[] bytes, int offset, int length) throws IOException;
    }

    private final class SourceContent {
        private final String key;
        private final long size;
        private final byte[] whole;

        SourceContent(String key, long size, byte[] whole) {
            this.key = key;
            this.size = size;
            this.whole = whole;
        }

        long size() {
            return size;
        }

        void copyTo(ByteTarget target, SliceChannel channel) throws IOException {
            if (whole != null) {
                target.write(whole, 0, whole.length);
                return;
            }
            long offset = 0;
            while (offset < size) {
                if (channel.failure() != null) {
                    throw new IOException("Archive pipeline failed: " + channel.failure().getMessage(), channel.failure());
                }
                long end = Math.min(size, offset + settings.readWindow()) - 1;
                byte[] window = storage.getRange(key, offset, end).await().indefinitely();
                long expected = end - offset + 1;
                if (window.length != expected) {
                    throw new IOException(String.format("Short read from %s at offset %d: got %d bytes, expected %d",
                            key, offset, window.length, expected));
                }
                target.write(window, 0, window.length);
                offset += window.length;
            }
        }
    }

    private void saveProgress(ArchiveJob job, ArchiveProgress progress) {
        store.put(MetadataKeys.archiveProgress(job.sessionId()), codec.encode(progress)).await().indefinitely();
    }

    private void deleteSources(ArchiveJob job) {
        for (ArchiveSource source : job.sources()) {
            storage.deleteObject(source.storageKey())
                    .onFailure().recoverWithItem(e -> {
                        LOG.warnf("Failed to delete source object %s: %s", source.storageKey(), e.getMessage());
                        return null;
                    })
                    .await().indefinitely();
        }
    }

    private String createUpload(ArchiveJob job, String key) {
        try {
            return storage.createMultipart(key).await().indefinitely();
        } catch (RuntimeException e) {
            throw ArchiveBuildException.failed(job.sessionId(), e);
        }
    }

    private static <T> T awaitUntil(CompletableFuture<T> future, long deadlineNanos) throws Exception {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
