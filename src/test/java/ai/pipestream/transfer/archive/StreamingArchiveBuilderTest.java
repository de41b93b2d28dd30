package ai.pipestream.transfer.archive;

import ai.pipestream.transfer.exception.ArchiveBuildException;
import ai.pipestream.transfer.metadata.InMemoryMetadataStore;
import ai.pipestream.transfer.metadata.MetadataCodec;
import ai.pipestream.transfer.metadata.MetadataKeys;
import ai.pipestream.transfer.observability.TransferObserver;
import ai.pipestream.transfer.storage.InMemoryMultipartStorageClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.*;

class StreamingArchiveBuilderTest {

    private static final int PART_SIZE = 50 * 1024;
    private static final Instant ENTRY_TIME = Instant.parse("2025-06-01T08:00:00Z");
    private static final Duration WAIT = Duration.ofSeconds(30);

    @TempDir
    Path tempDir;

    private InMemoryMultipartStorageClient storage;
    private InMemoryMetadataStore store;
    private MetadataCodec codec;
    private ExecutorService executor;
    private RecordingObserver observer;
    private StreamingArchiveBuilder builder;

    @BeforeEach
    void setUp() {
        storage = new InMemoryMultipartStorageClient();
        store = new InMemoryMetadataStore(10_000, Duration.ofHours(1), null);
        codec = MetadataCodec.standalone();
        executor = Executors.newCachedThreadPool();
        observer = new RecordingObserver();
        builder = builder(Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private StreamingArchiveBuilder builder(Duration finalizeTimeout) {
        ArchiveSettings settings = new ArchiveSettings("archives", "files.zip", PART_SIZE, 10 * 1024,
                16 * 1024, 4, 7_000, finalizeTimeout);
        return new StreamingArchiveBuilder(storage, store, codec, settings, observer, executor);
    }

    @Test
    void packsSourcesIntoStandardSizeParts() throws IOException {
        Map<String, byte[]> sources = new LinkedHashMap<>();
        sources.put("a.bin", StoredZipWriterTest.randomBytes(40 * 1024, 1));
        sources.put("b.txt", StoredZipWriterTest.randomBytes(1024, 2));
        sources.put("c.bin", StoredZipWriterTest.randomBytes(90 * 1024, 3));
        ArchiveJob job = job("s1", "arc-1", sources, false);

        ArchiveResult result = builder.build(job).await().atMost(WAIT);

        byte[] expected = reference(sources);
        byte[] archive = storage.objectBytes("archives/arc-1");
        assertArrayEquals(expected, archive);
        assertEquals("archives/arc-1", result.storageKey());
        assertEquals("files.zip", result.fileName());
        assertEquals(3, result.fileCount());
        assertEquals(expected.length, result.sizeBytes());

        List<Integer> parts = storage.serverPartSizes("archives/arc-1");
        assertEquals(3, result.partCount());
        assertEquals(List.of(PART_SIZE, PART_SIZE, expected.length - 2 * PART_SIZE), parts);
        assertEquals(3, observer.parts.size());

        try (ZipFile zip = open(archive)) {
            assertEquals(3, zip.size());
            for (Map.Entry<String, byte[]> source : sources.entrySet()) {
                try (InputStream in = zip.getInputStream(zip.getEntry(source.getKey()))) {
                    assertArrayEquals(source.getValue(), in.readAllBytes());
                }
            }
        }
    }

    @Test
    void sourcesAreDeletedAndProgressEndsFinalizing() {
        Map<String, byte[]> sources = Map.of("only.txt", new byte[]{1, 2, 3});
        builder.build(job("s2", "arc-2", sources, false)).await().atMost(WAIT);

        assertTrue(storage.deletedKeys().contains("temp/s2/only.txt"));
        assertFalse(storage.hasObject("temp/s2/only.txt"));
        ArchiveProgress progress = codec.decode(
                store.get(MetadataKeys.archiveProgress("s2")).await().indefinitely(), ArchiveProgress.class);
        assertEquals(ArchiveProgress.Phase.FINALIZING, progress.phase());
        assertEquals(90, progress.percent());
    }

    @Test
    void singleZipIsRepublishedUnchanged() {
        byte[] bundle = StoredZipWriterTest.randomBytes(120 * 1024, 9);
        ArchiveJob job = job("s3", "arc-3", Map.of("bundle.zip", bundle), true);

        ArchiveResult result = builder.build(job).await().atMost(WAIT);

        assertArrayEquals(bundle, storage.objectBytes("archives/arc-3"));
        assertEquals("bundle.zip", result.fileName());
        assertEquals(1, result.fileCount());
        assertEquals(3, result.partCount());
    }

    @Test
    void failedHeadFallsBackToFullRead() {
        Map<String, byte[]> sources = Map.of("x.bin", StoredZipWriterTest.randomBytes(30 * 1024, 4));
        storage.failHead("temp/s4/x.bin");
        putSources("s4", sources);

        builder.build(new ArchiveJob("s4", "arc-4",
                List.of(new ArchiveSource("x.bin", "temp/s4/x.bin")), ENTRY_TIME, false)).await().atMost(WAIT);

        assertArrayEquals(reference(sources), storage.objectBytes("archives/arc-4"));
    }

    @Test
    void failedPartUploadAbortsTheArchive() {
        storage.failUploadPart(2);
        Map<String, byte[]> sources = Map.of("big.bin", StoredZipWriterTest.randomBytes(200 * 1024, 5));
        ArchiveJob job = job("s5", "arc-5", sources, false);

        ArchiveBuildException error = assertThrows(ArchiveBuildException.class,
                () -> builder.build(job).await().atMost(WAIT));

        assertEquals("BUILDER_FAILURE", error.getErrorCode());
        assertEquals(1, storage.abortedUploads().size());
        assertEquals(0, storage.openUploads());
        assertFalse(storage.hasObject("archives/arc-5"));
        assertTrue(storage.hasObject("temp/s5/big.bin"));
    }

    @Test
    void missingSourceAbortsTheArchive() {
        ArchiveJob job = new ArchiveJob("s6", "arc-6",
                List.of(new ArchiveSource("gone.bin", "temp/s6/gone.bin")), ENTRY_TIME, false);

        assertThrows(ArchiveBuildException.class, () -> builder.build(job).await().atMost(WAIT));
        assertEquals(1, storage.abortedUploads().size());
    }

    @Test
    void hangingPartUploadTimesOutTheFinalize() {
        storage.hangUploadPart(1);
        StreamingArchiveBuilder impatient = builder(Duration.ofMillis(300));
        ArchiveJob job = job("s7", "arc-7", Map.of("a.bin", StoredZipWriterTest.randomBytes(60 * 1024, 6)), false);

        ArchiveBuildException error = assertThrows(ArchiveBuildException.class,
                () -> impatient.build(job).await().atMost(WAIT));

        assertTrue(error.getMessage().contains("pending"), error.getMessage());
        assertEquals(1, storage.abortedUploads().size());
    }

    @Test
    void passthroughDetection() {
        assertTrue(StreamingArchiveBuilder.isPassthrough(List.of("Photos.ZIP")));
        assertFalse(StreamingArchiveBuilder.isPassthrough(List.of("a.zip", "b.zip")));
        assertFalse(StreamingArchiveBuilder.isPassthrough(List.of("notes.txt")));
        assertFalse(StreamingArchiveBuilder.isPassthrough(List.of()));
    }

    private ArchiveJob job(String sessionId, String archiveId, Map<String, byte[]> sources, boolean passthrough) {
        putSources(sessionId, sources);
        List<ArchiveSource> list = new ArrayList<>();
        for (String name : sources.keySet()) {
            list.add(new ArchiveSource(name, "temp/" + sessionId + "/" + name));
        }
        return new ArchiveJob(sessionId, archiveId, list, ENTRY_TIME, passthrough);
    }

    private void putSources(String sessionId, Map<String, byte[]> sources) {
        sources.forEach((name, bytes) -> storage.putObject("temp/" + sessionId + "/" + name, bytes));
    }

    private static byte[] reference(Map<String, byte[]> sources) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            StoredZipWriter writer = new StoredZipWriter(out);
            for (Map.Entry<String, byte[]> source : sources.entrySet()) {
                writer.putEntry(source.getKey(), ENTRY_TIME, source.getValue().length);
                writer.write(source.getValue());
                writer.closeEntry();
            }
            writer.finish();
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private ZipFile open(byte[] bytes) throws IOException {
        Path file = Files.createTempFile(tempDir, "archive", ".zip");
        Files.write(file, bytes);
        return new ZipFile(file.toFile());
    }

    private static final class RecordingObserver implements TransferObserver {
        final Map<Integer, Long> parts = new ConcurrentHashMap<>();

        @Override
        public void partUploaded(String key, int partNumber, long bytes) {
            parts.put(partNumber, bytes);
        }
    }
}
