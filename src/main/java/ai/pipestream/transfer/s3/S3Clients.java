package ai.pipestream.transfer.s3;

import ai.pipestream.transfer.config.S3Config;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.retry.AwsRetryStrategy;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@ApplicationScoped
public class S3Clients {

    private static final Logger LOG = Logger.getLogger(S3Clients.class);

    /**
     * Produces the S3AsyncClient used for all control calls.
     * SDK retries are off; every call goes through the service's own retry policy.
     */
    @Produces
    @ApplicationScoped
    public S3AsyncClient s3AsyncClient(S3Config config) {
        LOG.infof("Creating S3 client: endpoint=%s, region=%s, bucket=%s", config.endpoint(), config.region(), config.bucket());
        return S3AsyncClient.builder()
                .credentialsProvider(credentials(config))
                .region(Region.of(config.region()))
                .endpointOverride(URI.create(config.endpoint()))
                .serviceConfiguration(serviceConfiguration(config))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(config.callTimeout())
                        .apiCallAttemptTimeout(config.callAttemptTimeout())
                        .retryStrategy(AwsRetryStrategy.doNotRetry())
                        .build())
                .build();
    }

    /**
     * Produces the presigner that hands out time-boxed part upload URLs.
     */
    @Produces
    @ApplicationScoped
    public S3Presigner s3Presigner(S3Config config) {
        return S3Presigner.builder()
                .credentialsProvider(credentials(config))
                .region(Region.of(config.region()))
                .endpointOverride(URI.create(config.endpoint()))
                .serviceConfiguration(serviceConfiguration(config))
                .build();
    }

    void closeClient(@Disposes S3AsyncClient client) {
        client.close();
    }

    void closePresigner(@Disposes S3Presigner presigner) {
        presigner.close();
    }

    private static StaticCredentialsProvider credentials(S3Config config) {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(config.accessKey(), config.secretKey()));
    }

    private static S3Configuration serviceConfiguration(S3Config config) {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(config.pathStyleAccess())
                .build();
    }
}
