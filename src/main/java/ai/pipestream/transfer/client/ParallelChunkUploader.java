package ai.pipestream.transfer.client;

import ai.pipestream.transfer.retry.RetryPolicy;
import ai.pipestream.transfer.session.FileUploadPlan;
import ai.pipestream.transfer.session.SessionDescriptor;
import ai.pipestream.transfer.storage.PartUploadDescriptor;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Uploads local files chunk by chunk to their pre-signed part URLs with a bounded pool of workers.
 * <p>
 * Workers claim chunks from one shared queue, so every chunk is uploaded by exactly one worker.
 * A chunk is confirmed only after its PUT succeeded. {@link #cancel()} stops workers from
 * claiming more chunks; chunks already in flight finish, and nothing is sealed.
 */
public class ParallelChunkUploader {

    private static final Logger LOG = Logger.getLogger(ParallelChunkUploader.class);

    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 8;

    private final PartTransport transport;
    private final RetryPolicy retry;
    private final int concurrency;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ParallelChunkUploader(PartTransport transport, RetryPolicy retry, int concurrency) {
        if (concurrency < MIN_CONCURRENCY || concurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException(String.format(
                    "concurrency must be between %d and %d, got %d", MIN_CONCURRENCY, MAX_CONCURRENCY, concurrency));
        }
        this.transport = transport;
        this.retry = retry;
        this.concurrency = concurrency;
    }

    /**
     * Uploads every chunk of every file in the descriptor and blocks until all workers are done.
     *
     * @param localFiles local path of each declared file, keyed by file name
     */
    public UploadReport upload(SessionDescriptor descriptor, Map<String, Path> localFiles, ChunkConfirmer confirmer) {
        Queue<ChunkTask> queue = new ConcurrentLinkedQueue<>();
        for (FileUploadPlan plan : descriptor.files()) {
            Path path = localFiles.get(plan.name());
            if (path == null) {
                throw new IllegalArgumentException("No local file for " + plan.name());
            }
            for (int index = 0; index < plan.totalChunks(); index++) {
                queue.add(new ChunkTask(plan, path, index));
            }
        }
        LOG.infof("Uploading %d chunk(s) of %d file(s) with %d worker(s)",
                queue.size(), descriptor.files().size(), concurrency);

        Map<String, List<Integer>> confirmed = new ConcurrentHashMap<>();
        Map<String, List<Integer>> failed = new ConcurrentHashMap<>();
        AtomicInteger claimed = new AtomicInteger();
        int total = queue.size();

        ExecutorService workers = Executors.newFixedThreadPool(concurrency);
        try {
            List<Future<?>> running = new ArrayList<>(concurrency);
            for (int i = 0; i < concurrency; i++) {
                running.add(workers.submit(() -> {
                    ChunkTask task;
                    while (!cancelled.get() && (task = queue.poll()) != null) {
                        claimed.incrementAndGet();
                        String name = task.plan().name();
                        try {
                            uploadChunk(task, descriptor.chunkSize(), confirmer);
                            confirmed.computeIfAbsent(name, k -> Collections.synchronizedList(new ArrayList<>()))
                                    .add(task.index());
                        } catch (RuntimeException e) {
                            LOG.warnf("Chunk %d of %s failed: %s", task.index(), name, e.getMessage());
                            failed.computeIfAbsent(name, k -> Collections.synchronizedList(new ArrayList<>()))
                                    .add(task.index());
                        }
                    }
                }));
            }
            for (Future<?> worker : running) {
                worker.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Upload worker crashed", e.getCause());
        } finally {
            workers.shutdownNow();
        }

        boolean stoppedEarly = cancelled.get() && claimed.get() < total;
        return new UploadReport(sorted(confirmed), sorted(failed), stoppedEarly);
    }

    /**
     * Stops claiming new chunks. Advisory: chunks in flight complete normally.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Upload cancelled, no further chunks will be claimed");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private void uploadChunk(ChunkTask task, long chunkSize, ChunkConfirmer confirmer) {
        PartUploadDescriptor part = task.plan().parts().get(task.index());
        byte[] bytes = readSlice(task.path(), task.plan().size(), chunkSize, task.index());
        String label = "put " + task.plan().name() + "#" + part.partNumber();

        String eTag = retry.execute(() -> transport.put(part, bytes), label).await().indefinitely();
        retry.execute(() -> confirmer.confirm(task.plan().name(), task.index(), part.partNumber(), eTag)
                        .replaceWithVoid(), "confirm " + task.plan().name() + "#" + part.partNumber())
                .await().indefinitely();
    }

    static byte[] readSlice(Path path, long fileSize, long chunkSize, int index) {
        long offset = index * chunkSize;
        int length = (int) Math.max(0L, Math.min(chunkSize, fileSize - offset));
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, offset + buffer.position());
                if (read < 0) {
                    throw new IOException("Unexpected end of " + path + " at offset " + (offset + buffer.position()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.array();
    }

    private static Map<String, List<Integer>> sorted(Map<String, List<Integer>> byFile) {
        Map<String, List<Integer>> result = new TreeMap<>();
        byFile.forEach((name, indices) -> {
            List<Integer> copy = new ArrayList<>(indices);
            Collections.sort(copy);
            result.put(name, List.copyOf(copy));
        });
        return result;
    }

    private record ChunkTask(FileUploadPlan plan, Path path, int index) {
    }
}
