package com.wpanther.kmscert.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterTier;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;
import software.amazon.awssdk.services.ssm.model.PutParameterResponse;
import software.amazon.awssdk.services.ssm.model.SsmException;

/**
 * Unit tests for SsmSinkWriter
 */
@ExtendWith(MockitoExtension.class)
class SsmSinkWriterTest {

    private static final String REGION = "eu-central-1";
    private static final String NAME = "/certs/web";

    @Mock
    private AwsClientFactory clientFactory;

    @Mock
    private SsmClient client;

    @InjectMocks
    private SsmSinkWriter writer;

    private final SinkTarget.SsmParameter target = new SinkTarget.SsmParameter(REGION, NAME, null);

    @BeforeEach
    void setUp() {
        when(clientFactory.ssm(REGION)).thenReturn(client);
    }

    @Test
    void testNewParameterCreatedWithoutOverwrite() {
        // Arrange
        when(client.getParameter(any(GetParameterRequest.class)))
            .thenThrow(ParameterNotFoundException.builder().message("not found").build());
        when(client.putParameter(any(PutParameterRequest.class))).thenReturn(PutParameterResponse.builder().version(1L).build());

        // Act
        writer.write(target, "pem");

        // Assert
        ArgumentCaptor<PutParameterRequest> captor = ArgumentCaptor.forClass(PutParameterRequest.class);
        verify(client).putParameter(captor.capture());
        assertThat(captor.getValue().name()).isEqualTo(NAME);
        assertThat(captor.getValue().value()).isEqualTo("pem");
        assertThat(captor.getValue().type()).isEqualTo(ParameterType.STRING);
        assertThat(captor.getValue().tier()).isEqualTo(ParameterTier.STANDARD);
        assertThat(captor.getValue().overwrite()).isFalse();
    }

    @Test
    void testExistingParameterOverwritten() {
        // Arrange
        when(client.getParameter(any(GetParameterRequest.class))).thenReturn(GetParameterResponse.builder()
            .parameter(Parameter.builder().name(NAME).value("old").build())
            .build());
        when(client.putParameter(any(PutParameterRequest.class))).thenReturn(PutParameterResponse.builder().version(2L).build());

        // Act
        writer.write(target, "new");

        // Assert
        ArgumentCaptor<PutParameterRequest> captor = ArgumentCaptor.forClass(PutParameterRequest.class);
        verify(client).putParameter(captor.capture());
        assertThat(captor.getValue().overwrite()).isTrue();
    }

    @Test
    void testLargePayloadUsesAdvancedTier() {
        // Arrange
        when(client.getParameter(any(GetParameterRequest.class)))
            .thenThrow(ParameterNotFoundException.builder().message("not found").build());
        when(client.putParameter(any(PutParameterRequest.class))).thenReturn(PutParameterResponse.builder().build());

        // Act
        writer.write(target, "x".repeat(SsmSinkWriter.STANDARD_TIER_MAX_BYTES + 1));

        // Assert
        ArgumentCaptor<PutParameterRequest> captor = ArgumentCaptor.forClass(PutParameterRequest.class);
        verify(client).putParameter(captor.capture());
        assertThat(captor.getValue().tier()).isEqualTo(ParameterTier.ADVANCED);
    }

    @Test
    void testProbeAccessDeniedFailsWrite() {
        // Arrange
        when(client.getParameter(any(GetParameterRequest.class)))
            .thenThrow(SsmException.builder().message("AccessDeniedException").statusCode(400).build());

        // Act & Assert
        assertThatThrownBy(() -> writer.write(target, "pem"))
            .isInstanceOf(SinkWriteException.class)
            .hasMessageContaining(NAME);
        verify(client, never()).putParameter(any(PutParameterRequest.class));
    }
}
