package com.wpanther.kmscert.output;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Stores the certificate as an S3 object, replacing any existing object
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class S3SinkWriter {

    private final AwsClientFactory clientFactory;

    public void write(SinkTarget.S3Object target, String payload) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(target.getBucket())
                .key(target.getKey())
                .contentType(target.isJson() ? "application/json" : "application/x-pem-file")
                .build();

            clientFactory.s3(target.getRegion()).putObject(request, RequestBody.fromString(payload));
            log.info("Stored certificate in s3://{}/{}", target.getBucket(), target.getKey());

        } catch (SdkException e) {
            log.error("Failed to store certificate in S3", e);
            throw new SinkWriteException("Failed to store certificate in s3://" + target.getBucket() + "/"
                + target.getKey() + ": " + e.getMessage(), e);
        }
    }
}
