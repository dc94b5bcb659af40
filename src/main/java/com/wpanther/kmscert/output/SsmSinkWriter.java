package com.wpanther.kmscert.output;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterTier;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;

/**
 * Creates or updates an SSM Parameter Store parameter holding the certificate
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SsmSinkWriter {

    /**
     * Largest value a standard-tier parameter accepts
     */
    static final int STANDARD_TIER_MAX_BYTES = 4096;

    private final AwsClientFactory clientFactory;

    public void write(SinkTarget.SsmParameter target, String payload) {
        SsmClient client = clientFactory.ssm(target.getRegion());
        String name = target.getParameterName();

        boolean exists = parameterExists(client, name);
        try {
            client.putParameter(PutParameterRequest.builder()
                .name(name)
                .value(payload)
                .type(ParameterType.STRING)
                .tier(payload.length() > STANDARD_TIER_MAX_BYTES ? ParameterTier.ADVANCED : ParameterTier.STANDARD)
                .overwrite(exists)
                .build());
            log.info("{} parameter {}", exists ? "Updated" : "Created", name);
        } catch (SdkException e) {
            log.error("Failed to write certificate to Parameter Store", e);
            throw new SinkWriteException("Failed to write parameter " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Only ParameterNotFoundException means the parameter is absent; any other
     * error fails the write
     */
    private boolean parameterExists(SsmClient client, String name) {
        try {
            client.getParameter(GetParameterRequest.builder().name(name).build());
            return true;
        } catch (ParameterNotFoundException e) {
            log.debug("Parameter {} does not exist yet", name);
            return false;
        } catch (SdkException e) {
            log.error("Failed to look up parameter {}", name, e);
            throw new SinkWriteException("Failed to look up parameter " + name + ": " + e.getMessage(), e);
        }
    }
}
