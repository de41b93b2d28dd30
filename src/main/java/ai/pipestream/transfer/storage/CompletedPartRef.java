package ai.pipestream.transfer.storage;

/**
 * A part that was accepted by the object store, as listed in a multipart completion.
 */
public record CompletedPartRef(int partNumber, String eTag) {
}
