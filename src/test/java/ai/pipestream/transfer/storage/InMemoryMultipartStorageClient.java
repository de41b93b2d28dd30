package ai.pipestream.transfer.storage;

import ai.pipestream.transfer.exception.StorageCallException;
import com.google.common.hash.Hashing;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Object store double keeping multipart uploads and objects in memory.
 * Also plays the client side: {@link #putPart} stands in for a PUT to a pre-signed URL.
 */
@Alternative
@ApplicationScoped
public class InMemoryMultipartStorageClient implements MultipartStorageClient {

    private final Map<String, Upload> uploads = new ConcurrentHashMap<>();
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();

    private final List<String> aborted = new CopyOnWriteArrayList<>();
    private final List<String> completedKeys = new CopyOnWriteArrayList<>();
    private final List<String> deletedKeys = new CopyOnWriteArrayList<>();
    private final Map<String, List<Integer>> serverPartSizes = new ConcurrentHashMap<>();

    private final Set<String> failCreateFor = ConcurrentHashMap.newKeySet();
    private final Set<String> failCompleteFor = ConcurrentHashMap.newKeySet();
    private final Set<String> failHeadFor = ConcurrentHashMap.newKeySet();
    private final Set<String> failAuthorizeFor = ConcurrentHashMap.newKeySet();
    private final Set<Integer> failUploadPart = ConcurrentHashMap.newKeySet();
    private final Set<Integer> hangUploadPart = ConcurrentHashMap.newKeySet();

    private static final class Upload {
        final String key;
        final Map<Integer, byte[]> parts = new ConcurrentSkipListMap<>();
        final Map<Integer, String> eTags = new ConcurrentHashMap<>();

        Upload(String key) {
            this.key = key;
        }
    }

    @Override
    public Uni<String> createMultipart(String key) {
        return Uni.createFrom().item(() -> {
            if (failCreateFor.contains(key)) {
                throw new StorageCallException("createMultipart", key, 403, "injected failure");
            }
            String id = "mp-" + ids.incrementAndGet();
            uploads.put(id, new Upload(key));
            return id;
        });
    }

    @Override
    public Uni<PartUploadDescriptor> authorizePartUpload(String key, String multipartId, int partNumber) {
        return Uni.createFrom().item(() -> {
            if (failAuthorizeFor.contains(key)) {
                throw new IllegalStateException("presigner unavailable for " + key);
            }
            return new PartUploadDescriptor(partNumber,
                    "memory://" + key + "?uploadId=" + multipartId + "&partNumber=" + partNumber,
                    Map.of(), Instant.now().plusSeconds(3600));
        });
    }

    /**
     * Client-side part upload through a pre-signed URL.
     *
     * @return the quoted ETag, as an object store would send it
     */
    public String putPart(String key, String multipartId, int partNumber, byte[] bytes) {
        Upload upload = uploads.get(multipartId);
        if (upload == null || !upload.key.equals(key)) {
            throw new StorageCallException("putPart", key, 404, "NoSuchUpload " + multipartId);
        }
        String eTag = "\"" + Hashing.sha256().hashBytes(bytes).toString().substring(0, 32) + "\"";
        upload.parts.put(partNumber, bytes.clone());
        upload.eTags.put(partNumber, eTag);
        return eTag;
    }

    @Override
    public Uni<String> uploadPart(String key, String multipartId, int partNumber, byte[] bytes) {
        if (hangUploadPart.contains(partNumber)) {
            return Uni.createFrom().nothing();
        }
        return Uni.createFrom().item(() -> {
            if (failUploadPart.contains(partNumber)) {
                throw new StorageCallException("uploadPart", key, 500, "injected failure for part " + partNumber);
            }
            String eTag = putPart(key, multipartId, partNumber, bytes);
            serverPartSizes.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(bytes.length);
            return eTag;
        });
    }

    @Override
    public Uni<Void> completeMultipart(String key, String multipartId, List<CompletedPartRef> parts) {
        MultipartStorageClient.requireAscending(parts);
        return Uni.createFrom().item(() -> {
            if (failCompleteFor.contains(key)) {
                throw new StorageCallException("completeMultipart", key, 400, "injected failure");
            }
            Upload upload = uploads.get(multipartId);
            if (upload == null) {
                if (objects.containsKey(key)) {
                    return null;
                }
                throw new StorageCallException("completeMultipart", key, 404, "NoSuchUpload " + multipartId);
            }
            ByteArrayOutputStream assembled = new ByteArrayOutputStream();
            for (CompletedPartRef part : parts) {
                byte[] bytes = upload.parts.get(part.partNumber());
                String eTag = upload.eTags.get(part.partNumber());
                if (bytes == null || !strip(eTag).equals(strip(part.eTag()))) {
                    throw new StorageCallException("completeMultipart", key, 400, "InvalidPart " + part.partNumber());
                }
                assembled.writeBytes(bytes);
            }
            objects.put(key, assembled.toByteArray());
            uploads.remove(multipartId);
            completedKeys.add(key);
            return null;
        });
    }

    @Override
    public Uni<Void> abortMultipart(String key, String multipartId) {
        return Uni.createFrom().item(() -> {
            uploads.remove(multipartId);
            aborted.add(multipartId);
            return null;
        });
    }

    @Override
    public Uni<Long> headObject(String key) {
        return Uni.createFrom().item(() -> {
            if (failHeadFor.contains(key)) {
                throw new StorageCallException("headObject", key, 403, "injected failure");
            }
            return (long) object(key, "headObject").length;
        });
    }

    @Override
    public Uni<byte[]> getRange(String key, long start, long endInclusive) {
        return Uni.createFrom().item(() -> {
            byte[] bytes = object(key, "getRange");
            int end = (int) Math.min(bytes.length, endInclusive + 1);
            return Arrays.copyOfRange(bytes, (int) start, end);
        });
    }

    @Override
    public Uni<byte[]> getObject(String key) {
        return Uni.createFrom().item(() -> object(key, "getObject").clone());
    }

    @Override
    public Uni<Void> deleteObject(String key) {
        return Uni.createFrom().item(() -> {
            objects.remove(key);
            deletedKeys.add(key);
            return null;
        });
    }

    private byte[] object(String key, String operation) {
        byte[] bytes = objects.get(key);
        if (bytes == null) {
            throw new StorageCallException(operation, key, 404, "NoSuchKey");
        }
        return bytes;
    }

    private static String strip(String eTag) {
        return eTag == null ? "" : eTag.replace("\"", "");
    }

    public void putObject(String key, byte[] bytes) {
        objects.put(key, bytes.clone());
    }

    public byte[] objectBytes(String key) {
        return objects.get(key);
    }

    public boolean hasObject(String key) {
        return objects.containsKey(key);
    }

    public boolean isOpen(String multipartId) {
        return uploads.containsKey(multipartId);
    }

    public int openUploads() {
        return uploads.size();
    }

    public List<String> abortedUploads() {
        return Collections.unmodifiableList(aborted);
    }

    public List<String> completedKeys() {
        return Collections.unmodifiableList(completedKeys);
    }

    public List<String> deletedKeys() {
        return Collections.unmodifiableList(deletedKeys);
    }

    public List<Integer> serverPartSizes(String key) {
        return new ArrayList<>(serverPartSizes.getOrDefault(key, List.of()));
    }

    public void failCreate(String key) {
        failCreateFor.add(key);
    }

    public void failAuthorize(String key) {
        failAuthorizeFor.add(key);
    }

    public void failComplete(String key) {
        failCompleteFor.add(key);
    }

    public void recoverComplete(String key) {
        failCompleteFor.remove(key);
    }

    public void failHead(String key) {
        failHeadFor.add(key);
    }

    public void failUploadPart(int partNumber) {
        failUploadPart.add(partNumber);
    }

    public void hangUploadPart(int partNumber) {
        hangUploadPart.add(partNumber);
    }

    public void reset() {
        uploads.clear();
        objects.clear();
        aborted.clear();
        completedKeys.clear();
        deletedKeys.clear();
        serverPartSizes.clear();
        failCreateFor.clear();
        failCompleteFor.clear();
        failHeadFor.clear();
        failAuthorizeFor.clear();
        failUploadPart.clear();
        hangUploadPart.clear();
    }
}
