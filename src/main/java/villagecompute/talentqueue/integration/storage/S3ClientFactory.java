package villagecompute.talentqueue.integration.storage;

import java.net.URI;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Produces the {@link S3Client} used by {@link StorageGateway}.
 *
 * <p>
 * Works against AWS S3 or any S3-compatible endpoint (MinIO in dev, R2 in prod) via
 * {@code talentqueue.storage.endpoint}. Static credentials are used when both keys are configured, otherwise the
 * default AWS provider chain applies.
 */
@ApplicationScoped
public class S3ClientFactory {

    private static final Logger LOG = Logger.getLogger(S3ClientFactory.class);

    @ConfigProperty(
            name = "talentqueue.storage.endpoint")
    Optional<URI> endpoint;

    @ConfigProperty(
            name = "talentqueue.storage.region",
            defaultValue = "us-east-1")
    String region;

    @ConfigProperty(
            name = "talentqueue.storage.access-key")
    Optional<String> accessKey;

    @ConfigProperty(
            name = "talentqueue.storage.secret-key")
    Optional<String> secretKey;

    @ConfigProperty(
            name = "talentqueue.storage.path-style",
            defaultValue = "true")
    boolean pathStyle;

    @Produces
    @ApplicationScoped
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder().region(Region.of(region))
                .httpClientBuilder(UrlConnectionHttpClient.builder()).credentialsProvider(credentials())
                .forcePathStyle(pathStyle);
        endpoint.ifPresent(builder::endpointOverride);

        LOG.infof("Creating S3 client: region=%s, endpoint=%s, pathStyle=%s", region,
                endpoint.map(URI::toString).orElse("aws-default"), pathStyle);
        return builder.build();
    }

    void close(@Disposes S3Client client) {
        client.close();
    }

    private AwsCredentialsProvider credentials() {
        if (accessKey.isPresent() && secretKey.isPresent()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey.get(), secretKey.get()));
        }
        return DefaultCredentialsProvider.create();
    }
}
