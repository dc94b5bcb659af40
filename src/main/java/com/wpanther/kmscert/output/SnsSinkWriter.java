package com.wpanther.kmscert.output;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * Publishes the certificate to an SNS topic
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnsSinkWriter {

    private final AwsClientFactory clientFactory;

    public void write(SinkTarget.SnsTopic target, String payload) {
        try {
            PublishRequest request = PublishRequest.builder()
                .topicArn(target.getTopicArn())
                .message(payload)
                .build();

            PublishResponse response = clientFactory.sns(target.getRegion()).publish(request);
            log.info("Published message ID {} to: {}", response.messageId(), target.getTopicArn());

        } catch (SdkException e) {
            log.error("Failed to publish certificate to SNS", e);
            throw new SinkWriteException("Failed to publish certificate to " + target.getTopicArn() + ": "
                + e.getMessage(), e);
        }
    }
}
