package ai.pipestream.transfer.http;

import ai.pipestream.transfer.storage.InMemoryMultipartStorageClient;
import io.quarkus.test.junit.QuarkusTestProfile;

import java.util.Set;

/**
 * Runs the application against the in-memory object store, without the MinIO container.
 */
public class InMemoryStorageProfile implements QuarkusTestProfile {

    @Override
    public Set<Class<?>> getEnabledAlternatives() {
        return Set.of(InMemoryMultipartStorageClient.class);
    }

    @Override
    public boolean disableGlobalTestResources() {
        return true;
    }
}
