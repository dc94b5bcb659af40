package com.wpanther.kmscert.output;

import java.util.HashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.config.AwsClientFactory;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * Puts the certificate into a DynamoDB item. PutItem replaces an item with
 * the same key, so no existence check is needed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DynamoDbSinkWriter {

    private final AwsClientFactory clientFactory;

    public void write(SinkTarget.DynamoDbItem target, String payload) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(target.getHashKey(), AttributeValue.builder().s(target.getHashValue()).build());
        if (target.hasSortKey()) {
            item.put(target.getSortKey(), AttributeValue.builder().s(target.getSortValue()).build());
        }
        item.put(target.getPayloadAttribute(), AttributeValue.builder().s(payload).build());

        try {
            clientFactory.dynamoDb(target.getRegion()).putItem(PutItemRequest.builder()
                .tableName(target.getTable())
                .item(item)
                .build());
            log.info("Stored certificate in table {} under {}={}", target.getTable(),
                target.getHashKey(), target.getHashValue());

        } catch (SdkException e) {
            log.error("Failed to store certificate in DynamoDB", e);
            throw new SinkWriteException("Failed to store certificate in table " + target.getTable() + ": "
                + e.getMessage(), e);
        }
    }
}
