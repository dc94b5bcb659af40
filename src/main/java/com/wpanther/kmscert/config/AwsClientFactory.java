package com.wpanther.kmscert.config;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.ssm.SsmClient;

/**
 * Creates AWS service clients on demand, one per service and region.
 * Destinations name their own region, so clients cannot be singletons.
 */
@Component
@Slf4j
public class AwsClientFactory {

    private final AwsCredentialsProvider credentialsProvider;
    private final String defaultRegion;
    private final Map<String, SdkClient> clients = new HashMap<>();

    public AwsClientFactory(AwsCredentialsProvider credentialsProvider,
            @Value("${app.aws.region:us-east-1}") String defaultRegion) {
        this.credentialsProvider = credentialsProvider;
        this.defaultRegion = defaultRegion;
    }

    /**
     * KMS client for the region a key lives in. Key ARNs carry their region;
     * plain key IDs and aliases use the configured default region.
     */
    public KmsClient kms(String keyId) {
        String region = regionOfKey(keyId);
        return client(KmsClient.class, region, () -> KmsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public S3Client s3(String region) {
        return client(S3Client.class, region, () -> S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public SecretsManagerClient secretsManager(String region) {
        return client(SecretsManagerClient.class, region, () -> SecretsManagerClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public SnsClient sns(String region) {
        return client(SnsClient.class, region, () -> SnsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public SqsClient sqs(String region) {
        return client(SqsClient.class, region, () -> SqsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public SsmClient ssm(String region) {
        return client(SsmClient.class, region, () -> SsmClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public DynamoDbClient dynamoDb(String region) {
        return client(DynamoDbClient.class, region, () -> DynamoDbClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build());
    }

    /**
     * Extracts the region from a key ARN (arn:aws:kms:REGION:ACCOUNT:key/ID)
     */
    String regionOfKey(String keyId) {
        if (keyId != null && keyId.startsWith("arn:")) {
            String[] parts = keyId.split(":", 6);
            if (parts.length == 6 && !parts[3].isEmpty()) {
                return parts[3];
            }
        }
        return defaultRegion;
    }

    private <T extends SdkClient> T client(Class<T> type, String region, Supplier<T> factory) {
        SdkClient client = clients.computeIfAbsent(type.getSimpleName() + "/" + region, key -> {
            log.debug("Creating {} for region {}", type.getSimpleName(), region);
            return factory.get();
        });
        return type.cast(client);
    }

    @PreDestroy
    public void close() {
        clients.values().forEach(SdkClient::close);
        clients.clear();
    }
}
