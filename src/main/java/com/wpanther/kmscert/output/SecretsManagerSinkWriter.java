package com.wpanther.kmscert.output;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Creates or updates a Secrets Manager secret holding the certificate
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecretsManagerSinkWriter {

    private final AwsClientFactory clientFactory;

    public void write(SinkTarget.SecretsManagerSecret target, String payload) {
        SecretsManagerClient client = clientFactory.secretsManager(target.getRegion());
        String secretId = target.getSecretId();

        boolean exists = secretExists(client, secretId);
        try {
            if (exists) {
                client.putSecretValue(PutSecretValueRequest.builder()
                    .secretId(secretId)
                    .secretString(payload)
                    .build());
                log.info("Updated secret {}", secretId);
            } else {
                client.createSecret(CreateSecretRequest.builder()
                    .name(secretId)
                    .secretString(payload)
                    .build());
                log.info("Created secret {}", secretId);
            }
        } catch (SdkException e) {
            log.error("Failed to write certificate to Secrets Manager", e);
            throw new SinkWriteException("Failed to write secret " + secretId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Only ResourceNotFoundException means the secret is absent; any other
     * error (e.g. access denied) fails the write
     */
    private boolean secretExists(SecretsManagerClient client, String secretId) {
        try {
            client.describeSecret(DescribeSecretRequest.builder().secretId(secretId).build());
            return true;
        } catch (ResourceNotFoundException e) {
            log.debug("Secret {} does not exist yet", secretId);
            return false;
        } catch (SdkException e) {
            log.error("Failed to look up secret {}", secretId, e);
            throw new SinkWriteException("Failed to look up secret " + secretId + ": " + e.getMessage(), e);
        }
    }
}
