package ai.pipestream.transfer.client;

import ai.pipestream.transfer.retry.HttpStatusException;
import ai.pipestream.transfer.storage.PartUploadDescriptor;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * {@link PartTransport} issuing a plain HTTP PUT against the pre-signed URL.
 */
public class HttpPartTransport implements PartTransport {

    private static final Logger LOG = Logger.getLogger(HttpPartTransport.class);

    // managed by the HTTP client itself
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "content-length", "connection", "expect", "upgrade");

    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpPartTransport(Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build(), requestTimeout);
    }

    public HttpPartTransport(HttpClient client, Duration requestTimeout) {
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Uni<String> put(PartUploadDescriptor descriptor, byte[] bytes) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(descriptor.url()))
                .timeout(requestTimeout)
                .PUT(HttpRequest.BodyPublishers.ofByteArray(bytes));
        if (descriptor.signedHeaders() != null) {
            descriptor.signedHeaders().forEach((name, values) -> {
                if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    values.forEach(value -> builder.header(name, value));
                }
            });
        }
        HttpRequest request = builder.build();

        return Uni.createFrom().completionStage(() -> client.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
                .map(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        throw new HttpStatusException(status, "part " + descriptor.partNumber() + " rejected: " + response.body());
                    }
                    String eTag = response.headers().firstValue("ETag")
                            .orElseThrow(() -> new IllegalStateException(
                                    "No ETag returned for part " + descriptor.partNumber()));
                    LOG.debugf("Part %d uploaded: size=%d, eTag=%s", descriptor.partNumber(), bytes.length, eTag);
                    return eTag;
                });
    }
}
