package ai.pipestream.transfer.session;

import ai.pipestream.transfer.storage.PartUploadDescriptor;

import java.util.List;

/**
 * Where and how the client uploads one file: one pre-authorized part per chunk.
 */
public record FileUploadPlan(String name, long size, int totalChunks, String multipartId, List<PartUploadDescriptor> parts) {
}
