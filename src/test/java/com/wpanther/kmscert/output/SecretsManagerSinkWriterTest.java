package com.wpanther.kmscert.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceExistsException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;

/**
 * Unit tests for SecretsManagerSinkWriter
 */
@ExtendWith(MockitoExtension.class)
class SecretsManagerSinkWriterTest {

    private static final String REGION = "us-east-1";
    private static final String SECRET_ID = "prod/tls/certificate";

    @Mock
    private AwsClientFactory clientFactory;

    @Mock
    private SecretsManagerClient client;

    @InjectMocks
    private SecretsManagerSinkWriter writer;

    private final SinkTarget.SecretsManagerSecret target = new SinkTarget.SecretsManagerSecret(REGION, SECRET_ID, null);

    @BeforeEach
    void setUp() {
        when(clientFactory.secretsManager(REGION)).thenReturn(client);
    }

    @Test
    void testCreateThenUpdate() {
        // Arrange
        Map<String, String> secrets = new HashMap<>();
        backSecretsWith(secrets);

        // Act
        writer.write(target, "first");
        writer.write(target, "second");

        // Assert
        assertThat(secrets).containsOnly(Map.entry(SECRET_ID, "second"));
        verify(client, times(1)).createSecret(any(CreateSecretRequest.class));
        verify(client, times(1)).putSecretValue(any(PutSecretValueRequest.class));
    }

    @Test
    void testExistingSecretIsUpdated() {
        // Arrange
        Map<String, String> secrets = new HashMap<>();
        secrets.put(SECRET_ID, "old");
        backSecretsWith(secrets);

        // Act
        writer.write(target, "new");

        // Assert
        assertThat(secrets).containsEntry(SECRET_ID, "new");
        verify(client, never()).createSecret(any(CreateSecretRequest.class));
    }

    @Test
    void testProbeFailureOtherThanNotFoundFailsWrite() {
        // Arrange
        when(client.describeSecret(any(DescribeSecretRequest.class))).thenThrow(
            SecretsManagerException.builder().message("User is not authorized: AccessDenied").statusCode(403).build());

        // Act & Assert
        assertThatThrownBy(() -> writer.write(target, "payload"))
            .isInstanceOf(SinkWriteException.class)
            .hasMessageContaining("AccessDenied");
        verify(client, never()).createSecret(any(CreateSecretRequest.class));
        verify(client, never()).putSecretValue(any(PutSecretValueRequest.class));
    }

    @Test
    void testCreateFailureWrapped() {
        // Arrange
        when(client.describeSecret(any(DescribeSecretRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("not found").build());
        when(client.createSecret(any(CreateSecretRequest.class)))
            .thenThrow(SecretsManagerException.builder().message("LimitExceeded").build());

        // Act & Assert
        assertThatThrownBy(() -> writer.write(target, "payload"))
            .isInstanceOf(SinkWriteException.class)
            .hasMessageContaining(SECRET_ID);
    }

    /**
     * Stateful stand-in for the service: create fails on existing secrets,
     * put fails on missing ones. Lenient: not every test reaches both calls.
     */
    private void backSecretsWith(Map<String, String> secrets) {
        lenient().when(client.describeSecret(any(DescribeSecretRequest.class))).thenAnswer(invocation -> {
            DescribeSecretRequest request = invocation.getArgument(0);
            if (!secrets.containsKey(request.secretId())) {
                throw ResourceNotFoundException.builder().message("Secret not found").build();
            }
            return DescribeSecretResponse.builder().name(request.secretId()).build();
        });
        lenient().when(client.createSecret(any(CreateSecretRequest.class))).thenAnswer(invocation -> {
            CreateSecretRequest request = invocation.getArgument(0);
            if (secrets.containsKey(request.name())) {
                throw ResourceExistsException.builder().message("Secret exists").build();
            }
            secrets.put(request.name(), request.secretString());
            return CreateSecretResponse.builder().name(request.name()).build();
        });
        lenient().when(client.putSecretValue(any(PutSecretValueRequest.class))).thenAnswer(invocation -> {
            PutSecretValueRequest request = invocation.getArgument(0);
            if (!secrets.containsKey(request.secretId())) {
                throw ResourceNotFoundException.builder().message("Secret not found").build();
            }
            secrets.put(request.secretId(), request.secretString());
            return PutSecretValueResponse.builder().name(request.secretId()).build();
        });
    }
}
