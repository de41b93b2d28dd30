package ai.pipestream.transfer.session;

/**
 * A file the client intends to upload, as declared at init.
 */
public record FileDeclaration(String name, long size) {
}
