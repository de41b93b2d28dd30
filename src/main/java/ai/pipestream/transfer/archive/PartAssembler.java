package ai.pipestream.transfer.archive;

import java.io.IOException;

/**
 * Consumer side of the archive pipeline: regroups slices into parts of exactly
 * {@code partSize} bytes and hands each one to a {@link PartSink} as soon as it is full.
 * Whatever is left when the channel ends becomes the final part. A stream without any
 * bytes still yields one (empty) part.
 */
class PartAssembler {

    @FunctionalInterface
    interface PartSink {
        void accept(int partNumber, byte[] bytes) throws IOException;
    }

    private final SliceChannel channel;
    private final int partSize;
    private final PartSink sink;

    PartAssembler(SliceChannel channel, int partSize, PartSink sink) {
        this.channel = channel;
        this.partSize = partSize;
        this.sink = sink;
    }

    /**
     * Drains the channel until it ends.
     *
     * @return number of parts handed to the sink
     */
    int run() throws IOException {
        byte[] part = new byte[partSize];
        int filled = 0;
        int partNumber = 1;

        byte[] slice;
        while ((slice = channel.receive()) != null) {
            int offset = 0;
            while (offset < slice.length) {
                int n = Math.min(slice.length - offset, partSize - filled);
                System.arraycopy(slice, offset, part, filled, n);
                filled += n;
                offset += n;
                if (filled == partSize) {
                    sink.accept(partNumber++, part);
                    part = new byte[partSize];
                    filled = 0;
                }
            }
        }

        if (filled > 0 || partNumber == 1) {
            byte[] last = new byte[filled];
            System.arraycopy(part, 0, last, 0, filled);
            sink.accept(partNumber++, last);
        }
        return partNumber - 1;
    }
}
