package ai.pipestream.transfer.archive;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Cuts everything written to it into fixed-size slices and sends them down a {@link SliceChannel}.
 * {@link #close()} sends the partial last slice and ends the channel.
 */
class ChannelOutputStream extends OutputStream {

    private final SliceChannel channel;
    private final int sliceSize;

    private byte[] slice;
    private int position;
    private long count;
    private boolean closed;

    ChannelOutputStream(SliceChannel channel, int sliceSize) {
        this.channel = channel;
        this.sliceSize = sliceSize;
        this.slice = new byte[sliceSize];
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        int remaining = length;
        int from = offset;
        while (remaining > 0) {
            int n = Math.min(remaining, sliceSize - position);
            System.arraycopy(bytes, from, slice, position, n);
            position += n;
            from += n;
            remaining -= n;
            count += n;
            if (position == sliceSize) {
                channel.send(slice);
                slice = new byte[sliceSize];
                position = 0;
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (position > 0) {
            byte[] last = new byte[position];
            System.arraycopy(slice, 0, last, 0, position);
            channel.send(last);
        }
        channel.close();
    }

    long count() {
        return count;
    }
}
