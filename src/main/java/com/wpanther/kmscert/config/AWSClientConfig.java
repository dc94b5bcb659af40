package com.wpanther.kmscert.config;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

/**
 * Credentials and shared clients for KMS and the output destinations
 */
@Configuration
@Slf4j
public class AWSClientConfig {

    @Value("${app.aws.access-key-id:}")
    private String accessKeyId;

    @Value("${app.aws.secret-access-key:}")
    private String secretAccessKey;

    @Value("${app.aws.use-default-credentials:true}")
    private boolean useDefaultCredentials;

    @Value("${app.http.timeout-seconds:30}")
    private long httpTimeoutSeconds;

    /**
     * Credentials shared by every AWS client the tool creates
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        if (useDefaultCredentials) {
            // IAM role, environment variables, profile file, etc.
            log.debug("Using AWS default credentials provider chain");
            return DefaultCredentialsProvider.create();
        }

        if (accessKeyId == null || accessKeyId.isEmpty()
                || secretAccessKey == null || secretAccessKey.isEmpty()) {
            throw new IllegalStateException(
                "AWS credentials not configured. Set app.aws.access-key-id and "
                + "app.aws.secret-access-key or enable use-default-credentials.");
        }
        log.debug("Using static AWS credentials");
        return StaticCredentialsProvider.create(
            AwsBasicCredentials.create(accessKeyId, secretAccessKey)
        );
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(httpTimeoutSeconds))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
