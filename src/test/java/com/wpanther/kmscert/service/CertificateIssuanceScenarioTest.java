package com.wpanther.kmscert.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.kmscert.dto.CertificateRequest;
import com.wpanther.kmscert.dto.IssuanceRequest;
import com.wpanther.kmscert.dto.KeyDescriptor;
import com.wpanther.kmscert.output.CertificatePayloadFormatter;
import com.wpanther.kmscert.output.DestinationParser;
import com.wpanther.kmscert.output.DynamoDbSinkWriter;
import com.wpanther.kmscert.output.HttpSinkWriter;
import com.wpanther.kmscert.output.LocalSinkWriter;
import com.wpanther.kmscert.output.OutputSinkService;
import com.wpanther.kmscert.output.S3SinkWriter;
import com.wpanther.kmscert.output.SecretsManagerSinkWriter;
import com.wpanther.kmscert.output.SnsSinkWriter;
import com.wpanther.kmscert.output.SqsSinkWriter;
import com.wpanther.kmscert.output.SsmSinkWriter;
import com.wpanther.kmscert.util.PemUtil;

import jakarta.validation.Validation;
import software.amazon.awssdk.services.kms.model.KeySpec;
import software.amazon.awssdk.services.kms.model.KeyUsageType;

/**
 * Issues an RSA certificate end to end with KMS emulated by a local key,
 * printing it to stdout wrapped as JSON
 */
@ExtendWith(MockitoExtension.class)
class CertificateIssuanceScenarioTest {

    private static final String KEY_ID = "arn:aws:kms:us-east-1:111122223333:key/rsa";

    @Mock
    private AWSKMSService kmsService;

    @Test
    void testRsaCertificateToStdoutJson() throws Exception {
        // Arrange
        LocalSigningKey key = LocalSigningKey.rsa();
        when(kmsService.describeKey(KEY_ID)).thenReturn(KeyDescriptor.builder()
            .keyId(KEY_ID)
            .keySpec(KeySpec.RSA_2048)
            .keyUsage(KeyUsageType.SIGN_VERIFY)
            .enabled(true)
            .build());
        when(kmsService.getPublicKey(KEY_ID)).thenReturn(key.publicKeyDer());
        when(kmsService.signDigest(eq(KEY_ID), any(), any())).thenAnswer(invocation ->
            key.signDigest(invocation.getArgument(1), invocation.getArgument(2)));

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ObjectMapper objectMapper = new ObjectMapper();
        PemUtil pemUtil = new PemUtil();
        OutputSinkService outputSinkService = new OutputSinkService(
            new CertificatePayloadFormatter(objectMapper),
            new LocalSinkWriter(new PrintStream(stdout, true, StandardCharsets.UTF_8)),
            mock(HttpSinkWriter.class), mock(S3SinkWriter.class), mock(SecretsManagerSinkWriter.class),
            mock(SnsSinkWriter.class), mock(SqsSinkWriter.class), mock(SsmSinkWriter.class),
            mock(DynamoDbSinkWriter.class));
        CertificateIssuanceService service = new CertificateIssuanceService(
            kmsService,
            new KeySpecResolver(),
            new SigningHandleFactory(kmsService, mock(PKCS11Service.class)),
            new SelfSignedCertificateBuilder(Clock.systemUTC(), pemUtil),
            new DestinationParser(DestinationParser.DEFAULT_JSON_FIELD),
            outputSinkService,
            Validation.buildDefaultValidatorFactory().getValidator());

        IssuanceRequest request = IssuanceRequest.builder()
            .kmsKeyId(KEY_ID)
            .certificateRequest(CertificateRequest.builder().commonName("example.com").build())
            .destination("json:myCert")
            .build();

        // Act
        String pem = service.issue(request);

        // Assert
        JsonNode json = objectMapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(json.size()).isEqualTo(1);
        assertThat(json.get("myCert").asText()).startsWith("-----BEGIN CERTIFICATE-----").isEqualTo(pem);

        KeyMatcher keyMatcher = new KeyMatcher(pemUtil);
        String certificateKey = keyMatcher.toCanonicalPem(
            pemUtil.readCertificate(pem.getBytes(StandardCharsets.UTF_8)).getSubjectPublicKeyInfo());
        assertThat(keyMatcher.equal(certificateKey, keyMatcher.toCanonicalPem(key.keyPair().getPublic()))).isTrue();
    }
}
