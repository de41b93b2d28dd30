package ai.pipestream.transfer.storage;

import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Starts MinIO and points the service at it. Part sizes are raised to the real
 * 5 MiB minimum that MinIO enforces on non-final parts.
 */
public class MinioTestResource implements QuarkusTestResourceLifecycleManager {

    private static final String ACCESS_KEY = "minioadmin";
    private static final String SECRET_KEY = "minioadmin";
    private static final String BUCKET = "transfer-it";
    private static final String FIVE_MIB = String.valueOf(5 * 1024 * 1024);

    private GenericContainer<?> minio;

    @Override
    public Map<String, String> start() {
        minio = new GenericContainer<>(DockerImageName.parse("minio/minio:RELEASE.2025-01-20T14-49-07Z"))
                .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
                .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
                .withCommand("server", "/data")
                .withExposedPorts(9000);
        minio.start();

        String endpoint = "http://" + minio.getHost() + ":" + minio.getMappedPort(9000);
        createBucket(endpoint);

        Map<String, String> config = new HashMap<>();
        config.put("transfer.s3.endpoint", endpoint);
        config.put("transfer.s3.region", "us-east-1");
        config.put("transfer.s3.access-key", ACCESS_KEY);
        config.put("transfer.s3.secret-key", SECRET_KEY);
        config.put("transfer.s3.bucket", BUCKET);
        config.put("transfer.s3.path-style-access", "true");
        config.put("transfer.upload.chunk-size", FIVE_MIB);
        config.put("transfer.archive.standard-part-size", FIVE_MIB);
        config.put("transfer.archive.min-part-size", FIVE_MIB);
        config.put("transfer.archive.read-window", String.valueOf(1024 * 1024));
        config.put("transfer.archive.slice-size", String.valueOf(256 * 1024));
        return config;
    }

    private static void createBucket(String endpoint) {
        AwsBasicCredentials credentials = AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY);

        try (S3Client s3 = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of("us-east-1"))
                .endpointOverride(URI.create(endpoint))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .build()) {
            s3.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
        }
    }

    @Override
    public void stop() {
        if (minio != null) {
            minio.stop();
        }
    }
}
