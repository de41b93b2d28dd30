package ai.pipestream.transfer.archive;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Streaming ZIP writer for uncompressed (STORED) entries on a non-seekable output.
 * <p>
 * Each entry is written as local header, raw bytes and a data descriptor carrying CRC-32 and
 * sizes, so nothing has to be known before the bytes pass through. ZIP64 records are used when
 * an entry, an offset or the entry count crosses the classic format's limits. The output is a
 * pure function of entry names, times and bytes; how the bytes are split across
 * {@link #write} calls makes no difference.
 */
public class StoredZipWriter {

    private static final int LOCAL_HEADER_SIG = 0x04034b50;
    private static final int DATA_DESCRIPTOR_SIG = 0x08074b50;
    private static final int CENTRAL_HEADER_SIG = 0x02014b50;
    private static final int ZIP64_EOCD_SIG = 0x06064b50;
    private static final int ZIP64_LOCATOR_SIG = 0x07064b50;
    private static final int EOCD_SIG = 0x06054b50;

    // bit 3: sizes in data descriptor, bit 11: UTF-8 names
    private static final int FLAGS = 0x0808;
    private static final int METHOD_STORED = 0;
    private static final int VERSION_DEFAULT = 20;
    private static final int VERSION_ZIP64 = 45;
    private static final int ZIP64_EXTRA_ID = 0x0001;

    static final long MAX_32 = 0xFFFFFFFFL;
    static final int MAX_16 = 0xFFFF;

    private final OutputStream out;
    private final List<Entry> entries = new ArrayList<>();
    private final CRC32 crc = new CRC32();

    private long written;
    private Entry current;
    private boolean finished;

    public StoredZipWriter(OutputStream out) {
        this.out = out;
    }

    /**
     * Starts a new entry.
     *
     * @param expectedSize size of the entry's content; decides whether ZIP64 records are needed
     */
    public void putEntry(String name, Instant modified, long expectedSize) throws IOException {
        if (finished) {
            throw new IllegalStateException("Archive already finished");
        }
        if (current != null) {
            closeEntry();
        }
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        if (nameBytes.length > MAX_16) {
            throw new IllegalArgumentException("Entry name too long: " + name);
        }
        boolean zip64 = expectedSize >= MAX_32 || written >= MAX_32;
        Entry entry = new Entry(nameBytes, dosTime(modified), written, expectedSize, zip64);

        ByteBuffer header = buffer(30 + nameBytes.length + (zip64 ? 20 : 0));
        header.putInt(LOCAL_HEADER_SIG);
        header.putShort((short) (zip64 ? VERSION_ZIP64 : VERSION_DEFAULT));
        header.putShort((short) FLAGS);
        header.putShort((short) METHOD_STORED);
        header.putInt(entry.dosTime);
        header.putInt(0);
        header.putInt(zip64 ? (int) MAX_32 : 0);
        header.putInt(zip64 ? (int) MAX_32 : 0);
        header.putShort((short) nameBytes.length);
        header.putShort((short) (zip64 ? 20 : 0));
        header.put(nameBytes);
        if (zip64) {
            header.putShort((short) ZIP64_EXTRA_ID);
            header.putShort((short) 16);
            header.putLong(0L);
            header.putLong(0L);
        }
        emit(header);

        crc.reset();
        current = entry;
    }

    public void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }

    public void write(byte[] bytes, int offset, int length) throws IOException {
        if (current == null) {
            throw new IllegalStateException("No entry is open");
        }
        if (length == 0) {
            return;
        }
        out.write(bytes, offset, length);
        crc.update(bytes, offset, length);
        current.size += length;
        written += length;
    }

    /**
     * Ends the open entry with its data descriptor.
     *
     * @throws IOException if the entry's size differs from the size announced in {@link #putEntry}
     */
    public void closeEntry() throws IOException {
        if (current == null) {
            return;
        }
        Entry entry = current;
        current = null;
        if (entry.expectedSize >= 0 && entry.size != entry.expectedSize) {
            throw new IOException(String.format("Entry %s has %d bytes, expected %d",
                    new String(entry.name, StandardCharsets.UTF_8), entry.size, entry.expectedSize));
        }
        entry.crc = crc.getValue();

        ByteBuffer descriptor = buffer(entry.zip64 ? 24 : 16);
        descriptor.putInt(DATA_DESCRIPTOR_SIG);
        descriptor.putInt((int) entry.crc);
        if (entry.zip64) {
            descriptor.putLong(entry.size);
            descriptor.putLong(entry.size);
        } else {
            descriptor.putInt((int) entry.size);
            descriptor.putInt((int) entry.size);
        }
        emit(descriptor);
        entries.add(entry);
    }

    /**
     * Writes the central directory and end records. The underlying stream is left open.
     */
    public void finish() throws IOException {
        if (finished) {
            return;
        }
        closeEntry();
        finished = true;

        long directoryOffset = written;
        for (Entry entry : entries) {
            writeCentralHeader(entry);
        }
        long directorySize = written - directoryOffset;

        boolean zip64 = entries.size() >= MAX_16 || directoryOffset >= MAX_32 || directorySize >= MAX_32;
        if (zip64) {
            long zip64EndOffset = written;
            ByteBuffer end64 = buffer(56);
            end64.putInt(ZIP64_EOCD_SIG);
            end64.putLong(44L);
            end64.putShort((short) VERSION_ZIP64);
            end64.putShort((short) VERSION_ZIP64);
            end64.putInt(0);
            end64.putInt(0);
            end64.putLong(entries.size());
            end64.putLong(entries.size());
            end64.putLong(directorySize);
            end64.putLong(directoryOffset);
            emit(end64);

            ByteBuffer locator = buffer(20);
            locator.putInt(ZIP64_LOCATOR_SIG);
            locator.putInt(0);
            locator.putLong(zip64EndOffset);
            locator.putInt(1);
            emit(locator);
        }

        ByteBuffer end = buffer(22);
        end.putInt(EOCD_SIG);
        end.putShort((short) 0);
        end.putShort((short) 0);
        end.putShort((short) Math.min(entries.size(), MAX_16));
        end.putShort((short) Math.min(entries.size(), MAX_16));
        end.putInt((int) Math.min(directorySize, MAX_32));
        end.putInt((int) Math.min(directoryOffset, MAX_32));
        end.putShort((short) 0);
        emit(end);
        out.flush();
    }

    /**
     * @return bytes written so far
     */
    public long bytesWritten() {
        return written;
    }

    public int entryCount() {
        return entries.size();
    }

    private void writeCentralHeader(Entry entry) throws IOException {
        boolean largeSize = entry.size >= MAX_32;
        boolean largeOffset = entry.offset >= MAX_32;
        int extraLength = (largeSize ? 16 : 0) + (largeOffset ? 8 : 0);
        boolean zip64 = entry.zip64 || extraLength > 0;
        if (extraLength > 0) {
            extraLength += 4;
        }

        ByteBuffer header = buffer(46 + entry.name.length + extraLength);
        header.putInt(CENTRAL_HEADER_SIG);
        header.putShort((short) (zip64 ? VERSION_ZIP64 : VERSION_DEFAULT));
        header.putShort((short) (zip64 ? VERSION_ZIP64 : VERSION_DEFAULT));
        header.putShort((short) FLAGS);
        header.putShort((short) METHOD_STORED);
        header.putInt(entry.dosTime);
        header.putInt((int) entry.crc);
        header.putInt(largeSize ? (int) MAX_32 : (int) entry.size);
        header.putInt(largeSize ? (int) MAX_32 : (int) entry.size);
        header.putShort((short) entry.name.length);
        header.putShort((short) extraLength);
        header.putShort((short) 0);
        header.putShort((short) 0);
        header.putShort((short) 0);
        header.putInt(0);
        header.putInt(largeOffset ? (int) MAX_32 : (int) entry.offset);
        header.put(entry.name);
        if (extraLength > 0) {
            header.putShort((short) ZIP64_EXTRA_ID);
            header.putShort((short) (extraLength - 4));
            if (largeSize) {
                header.putLong(entry.size);
                header.putLong(entry.size);
            }
            if (largeOffset) {
                header.putLong(entry.offset);
            }
        }
        emit(header);
    }

    private void emit(ByteBuffer buffer) throws IOException {
        out.write(buffer.array(), 0, buffer.position());
        written += buffer.position();
    }

    private static ByteBuffer buffer(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * MS-DOS date (high 16 bits) and time (low 16 bits) in UTC. Times before 1980 are clamped.
     */
    static int dosTime(Instant instant) {
        LocalDateTime time = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        if (time.getYear() < 1980) {
            time = LocalDateTime.of(1980, 1, 1, 0, 0);
        }
        int date = ((time.getYear() - 1980) << 9) | (time.getMonthValue() << 5) | time.getDayOfMonth();
        int clock = (time.getHour() << 11) | (time.getMinute() << 5) | (time.getSecond() >> 1);
        return (date << 16) | clock;
    }

    private static final class Entry {
        final byte[] name;
        final int dosTime;
        final long offset;
        final long expectedSize;
        final boolean zip64;
        long size;
        long crc;

        Entry(byte[] name, int dosTime, long offset, long expectedSize, boolean zip64) {
            this.name = name;
            this.dosTime = dosTime;
            this.offset = offset;
            this.expectedSize = expectedSize;
            this.zip64 = zip64;
        }
    }
}
