package com.wpanther.kmscert.output;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

/**
 * Sends the certificate as a message on an SQS queue
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqsSinkWriter {

    private final AwsClientFactory clientFactory;

    public void write(SinkTarget.SqsQueue target, String payload) {
        try {
            SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(target.getQueueUrl())
                .messageBody(payload)
                .build();

            SendMessageResponse response = clientFactory.sqs(target.getRegion()).sendMessage(request);
            log.info("Sent message ID {} to: {}", response.messageId(), target.getQueueUrl());

        } catch (SdkException e) {
            log.error("Failed to send certificate to SQS", e);
            throw new SinkWriteException("Failed to send certificate to " + target.getQueueUrl() + ": "
                + e.getMessage(), e);
        }
    }
}
