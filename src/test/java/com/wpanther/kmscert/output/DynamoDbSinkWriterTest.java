package com.wpanther.kmscert.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;

/**
 * Unit tests for DynamoDbSinkWriter
 */
@ExtendWith(MockitoExtension.class)
class DynamoDbSinkWriterTest {

    private static final String REGION = "us-west-2";

    @Mock
    private AwsClientFactory clientFactory;

    @Mock
    private DynamoDbClient client;

    @InjectMocks
    private DynamoDbSinkWriter writer;

    @BeforeEach
    void setUp() {
        when(clientFactory.dynamoDb(REGION)).thenReturn(client);
    }

    @Test
    void testItemWithHashKeyOnly() {
        // Arrange
        when(client.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());
        SinkTarget.DynamoDbItem target =
            new SinkTarget.DynamoDbItem(REGION, "certs", "id", "web", null, null, "pem", null);

        // Act
        writer.write(target, "-----BEGIN CERTIFICATE-----");

        // Assert
        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(client).putItem(captor.capture());
        assertThat(captor.getValue().tableName()).isEqualTo("certs");
        assertThat(captor.getValue().item()).containsOnly(
            Map.entry("id", AttributeValue.builder().s("web").build()),
            Map.entry("pem", AttributeValue.builder().s("-----BEGIN CERTIFICATE-----").build()));
    }

    @Test
    void testItemWithSortKey() {
        // Arrange
        when(client.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());
        SinkTarget.DynamoDbItem target =
            new SinkTarget.DynamoDbItem(REGION, "certs", "id", "web", "version", "v2", "body", "certificate");

        // Act
        writer.write(target, "{\"certificate\":\"pem\"}");

        // Assert
        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(client).putItem(captor.capture());
        assertThat(captor.getValue().item())
            .hasSize(3)
            .containsEntry("version", AttributeValue.builder().s("v2").build())
            .containsEntry("body", AttributeValue.builder().s("{\"certificate\":\"pem\"}").build());
    }

    @Test
    void testServiceErrorWrapped() {
        // Arrange
        when(client.putItem(any(PutItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("Requested resource not found").build());
        SinkTarget.DynamoDbItem target =
            new SinkTarget.DynamoDbItem(REGION, "missing", "id", "web", null, null, "pem", null);

        // Act & Assert
        assertThatThrownBy(() -> writer.write(target, "pem"))
            .isInstanceOf(SinkWriteException.class)
            .hasMessageContaining("missing");
    }
}
