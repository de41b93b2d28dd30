package ai.pipestream.transfer.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persisted state of one upload session. Immutable; every change produces a new instance
 * that is written back with compare-and-set.
 *
 * @param credentialHash hash of the access credential, never the credential itself
 * @param archiveId      id of the published archive, present exactly when the state is DONE
 * @param passthrough    the only source is already a ZIP archive and is republished as is
 */
public record UploadSession(String id,
                            String credentialHash,
                            List<SourceFileTarget> files,
                            SessionState state,
                            Instant createdAt,
                            Instant sealedAt,
                            String archiveId,
                            String error,
                            boolean passthrough) {

    public UploadSession {
        files = List.copyOf(files);
        if ((archiveId != null) != (state == SessionState.DONE)) {
            throw new IllegalArgumentException(
                    "archiveId must be present exactly when the session is DONE (state=" + state + ")");
        }
    }

    public long totalChunks() {
        long total = 0;
        for (SourceFileTarget file : files) {
            total += file.totalChunks();
        }
        return total;
    }

    public Optional<SourceFileTarget> file(String name) {
        return files.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public UploadSession withFile(SourceFileTarget updated) {
        List<SourceFileTarget> replaced = new ArrayList<>(files.size());
        for (SourceFileTarget file : files) {
            replaced.add(file.name().equals(updated.name()) ? updated : file);
        }
        return new UploadSession(id, credentialHash, replaced, state, createdAt, sealedAt, archiveId, error, passthrough);
    }

    public UploadSession sealed(Instant at) {
        return new UploadSession(id, credentialHash, files, SessionState.SEALED, createdAt, at, null, null, passthrough);
    }

    public UploadSession archiving() {
        return new UploadSession(id, credentialHash, files, SessionState.ARCHIVING, createdAt, sealedAt, null, null, passthrough);
    }

    public UploadSession done(String resultArchiveId) {
        return new UploadSession(id, credentialHash, files, SessionState.DONE, createdAt, sealedAt, resultArchiveId, null, passthrough);
    }

    public UploadSession failed(String reason) {
        return new UploadSession(id, credentialHash, files, SessionState.FAILED, createdAt, sealedAt, null, reason, passthrough);
    }
}
