package ai.pipestream.transfer.archive;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded hand-off of byte slices from the archive producer to the part assembler.
 * <p>
 * Either side can fail the channel; the other side notices on its next send or receive.
 */
class SliceChannel {

    private static final byte[] END = new byte[0];
    private static final long POLL_MILLIS = 100;

    private final BlockingQueue<byte[]> queue;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    SliceChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Queues a non-empty slice, blocking while the channel is full.
     */
    void send(byte[] slice) throws IOException {
        if (slice.length == 0) {
            return;
        }
        offer(slice);
    }

    /**
     * Marks the end of the stream.
     */
    void close() throws IOException {
        offer(END);
    }

    /**
     * @return the next slice, or null once the producer closed the channel
     */
    byte[] receive() throws IOException {
        try {
            while (true) {
                checkFailure();
                byte[] slice = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (slice == END) {
                    return null;
                }
                if (slice != null) {
                    return slice;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for archive data");
        }
    }

    /**
     * Records the first failure; later failures are ignored.
     */
    void fail(Throwable error) {
        failure.compareAndSet(null, error);
    }

    Throwable failure() {
        return failure.get();
    }

    private void offer(byte[] slice) throws IOException {
        try {
            while (true) {
                checkFailure();
                if (queue.offer(slice, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while queueing archive data");
        }
    }

    private void checkFailure() throws IOException {
        Throwable error = failure.get();
        if (error != null) {
            throw new IOException("Archive pipeline failed: " + error.getMessage(), error);
        }
    }
}
