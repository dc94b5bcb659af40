package com.wpanther.kmscert.output;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Where a finished certificate goes. The set of destinations is closed: the
 * constructor is private, every variant is nested here, and callers dispatch
 * through {@link Visitor}, which has one method per variant.
 *
 * <p>A non-null {@code jsonField} means the certificate is wrapped as
 * {@code {"<jsonField>": "<pem>"}} before it is written.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class SinkTarget {

    private final String jsonField;

    private SinkTarget(String jsonField) {
        this.jsonField = jsonField;
    }

    public boolean isJson() {
        return jsonField != null;
    }

    public abstract DestinationKind getKind();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {

        R visitStdout(Stdout target);

        R visitLocalFile(LocalFile target);

        R visitHttpPost(HttpPost target);

        R visitS3Object(S3Object target);

        R visitSecretsManagerSecret(SecretsManagerSecret target);

        R visitSnsTopic(SnsTopic target);

        R visitSqsQueue(SqsQueue target);

        R visitSsmParameter(SsmParameter target);

        R visitDynamoDbItem(DynamoDbItem target);
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class Stdout extends SinkTarget {

        public Stdout(String jsonField) {
            super(jsonField);
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.STDOUT_JSON : DestinationKind.STDOUT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStdout(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class LocalFile extends SinkTarget {

        private final String path;

        public LocalFile(String path, String jsonField) {
            super(jsonField);
            this.path = path;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.FILE_JSON : DestinationKind.FILE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocalFile(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class HttpPost extends SinkTarget {

        private final String url;

        public HttpPost(String url, String jsonField) {
            super(jsonField);
            this.url = url;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.HTTP_POST_JSON : DestinationKind.HTTP_POST;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHttpPost(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class S3Object extends SinkTarget {

        private final String region;
        private final String bucket;
        private final String key;

        public S3Object(String region, String bucket, String key, String jsonField) {
            super(jsonField);
            this.region = region;
            this.bucket = bucket;
            this.key = key;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.S3_JSON_OBJECT : DestinationKind.S3_OBJECT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitS3Object(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class SecretsManagerSecret extends SinkTarget {

        private final String region;
        private final String secretId;

        public SecretsManagerSecret(String region, String secretId, String jsonField) {
            super(jsonField);
            this.region = region;
            this.secretId = secretId;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.SECRETS_MANAGER_JSON_SECRET : DestinationKind.SECRETS_MANAGER_SECRET;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSecretsManagerSecret(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class SnsTopic extends SinkTarget {

        private final String region;
        private final String topicArn;

        public SnsTopic(String region, String topicArn, String jsonField) {
            super(jsonField);
            this.region = region;
            this.topicArn = topicArn;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.SNS_JSON_MESSAGE : DestinationKind.SNS_MESSAGE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSnsTopic(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class SqsQueue extends SinkTarget {

        private final String region;
        private final String queueUrl;

        public SqsQueue(String region, String queueUrl, String jsonField) {
            super(jsonField);
            this.region = region;
            this.queueUrl = queueUrl;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.SQS_JSON_MESSAGE : DestinationKind.SQS_MESSAGE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSqsQueue(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class SsmParameter extends SinkTarget {

        private final String region;
        private final String parameterName;

        public SsmParameter(String region, String parameterName, String jsonField) {
            super(jsonField);
            this.region = region;
            this.parameterName = parameterName;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.SSM_JSON_PARAMETER : DestinationKind.SSM_PARAMETER;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSsmParameter(this);
        }
    }

    /**
     * Table item keyed by a hash key and an optional sort key; the certificate
     * is stored in {@code payloadAttribute}
     */
    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class DynamoDbItem extends SinkTarget {

        private final String region;
        private final String table;
        private final String hashKey;
        private final String hashValue;
        private final String sortKey;
        private final String sortValue;
        private final String payloadAttribute;

        public DynamoDbItem(String region, String table, String hashKey, String hashValue,
                String sortKey, String sortValue, String payloadAttribute, String jsonField) {
            super(jsonField);
            this.region = region;
            this.table = table;
            this.hashKey = hashKey;
            this.hashValue = hashValue;
            this.sortKey = sortKey;
            this.sortValue = sortValue;
            this.payloadAttribute = payloadAttribute;
        }

        public boolean hasSortKey() {
            return sortKey != null;
        }

        @Override
        public DestinationKind getKind() {
            return isJson() ? DestinationKind.DYNAMODB_JSON_ITEM : DestinationKind.DYNAMODB_ITEM;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDynamoDbItem(this);
        }
    }
}
