package com.wpanther.kmscert.output;

/**
 * Every destination a certificate can be written to
 */
public enum DestinationKind {
    STDOUT,
    STDOUT_JSON,
    FILE,
    FILE_JSON,
    HTTP_POST,
    HTTP_POST_JSON,
    S3_OBJECT,
    S3_JSON_OBJECT,
    SECRETS_MANAGER_SECRET,
    SECRETS_MANAGER_JSON_SECRET,
    SNS_MESSAGE,
    SNS_JSON_MESSAGE,
    SQS_MESSAGE,
    SQS_JSON_MESSAGE,
    SSM_PARAMETER,
    SSM_JSON_PARAMETER,
    DYNAMODB_ITEM,
    DYNAMODB_JSON_ITEM
}
