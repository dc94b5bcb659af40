package com.wpanther.kmscert.output;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.wpanther.kmscert.exception.InvalidDestinationException;

/**
 * Parses an output destination string into a {@link SinkTarget}.
 *
 * <p>The destination is a prefix followed by {@code |}-separated fields, for
 * example {@code s3:json:eu-west-1|bucket|certs/cert.json|pem}. The longest
 * matching prefix wins, so {@code s3:json:} is tried before {@code s3:}. JSON
 * variants accept one optional trailing field naming the JSON property.
 */
@Component
public class DestinationParser {

    public static final String DEFAULT_JSON_FIELD = "certificate";

    private static final String STDOUT = "stdout";
    private static final String STDOUT_JSON = "json";
    private static final String DELIMITER = "\\|";

    private final String defaultJsonField;
    private final Map<String, Function<String, SinkTarget>> parsers = new LinkedHashMap<>();

    public DestinationParser(@Value("${app.output.default-json-field:" + DEFAULT_JSON_FIELD + "}") String defaultJsonField) {
        this.defaultJsonField = defaultJsonField;

        Map<String, Function<String, SinkTarget>> byPrefix = new LinkedHashMap<>();
        byPrefix.put("json:", rest -> new SinkTarget.Stdout(rest.isEmpty() ? defaultJsonField : rest));
        byPrefix.put("file:", rest -> parseFile(rest, false));
        byPrefix.put("file:json:", rest -> parseFile(rest, true));
        byPrefix.put("http:", rest -> parseHttp(rest, false));
        byPrefix.put("http:json:", rest -> parseHttp(rest, true));
        byPrefix.put("s3:", rest -> parseS3(rest, false));
        byPrefix.put("s3:json:", rest -> parseS3(rest, true));
        byPrefix.put("secretsmanager:", rest -> parseSecretsManager(rest, false));
        byPrefix.put("secretsmanager:json:", rest -> parseSecretsManager(rest, true));
        byPrefix.put("sns:", rest -> parseSns(rest, false));
        byPrefix.put("sns:json:", rest -> parseSns(rest, true));
        byPrefix.put("sqs:", rest -> parseSqs(rest, false));
        byPrefix.put("sqs:json:", rest -> parseSqs(rest, true));
        byPrefix.put("ssm:", rest -> parseSsm(rest, false));
        byPrefix.put("ssm:json:", rest -> parseSsm(rest, true));
        byPrefix.put("dynamodb:", rest -> parseDynamoDb(rest, false));
        byPrefix.put("dynamodb:json:", rest -> parseDynamoDb(rest, true));

        byPrefix.entrySet().stream()
            .sorted(Comparator.comparingInt((Map.Entry<String, Function<String, SinkTarget>> e) -> e.getKey().length())
                .reversed())
            .forEachOrdered(e -> parsers.put(e.getKey(), e.getValue()));
    }

    public SinkTarget parse(String destination) {
        if (destination == null || destination.isBlank()) {
            throw new InvalidDestinationException("Output destination is required");
        }
        if (STDOUT.equals(destination)) {
            return new SinkTarget.Stdout(null);
        }
        if (STDOUT_JSON.equals(destination)) {
            return new SinkTarget.Stdout(defaultJsonField);
        }

        for (Map.Entry<String, Function<String, SinkTarget>> entry : parsers.entrySet()) {
            if (destination.startsWith(entry.getKey())) {
                return entry.getValue().apply(destination.substring(entry.getKey().length()));
            }
        }
        throw new InvalidDestinationException("Unrecognized output destination: " + destination);
    }

    private SinkTarget parseFile(String rest, boolean json) {
        String[] fields = split("file", rest, 1, json);
        return new SinkTarget.LocalFile(required("file", "path", fields[0]), jsonField(fields, 1, json));
    }

    private SinkTarget parseHttp(String rest, boolean json) {
        String[] fields = split("http", rest, 1, json);
        String url = required("http", "url", fields[0]);
        try {
            URI uri = new URI(url);
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                throw new InvalidDestinationException("http destination needs an http or https URL: " + url);
            }
            if (uri.getHost() == null) {
                throw new InvalidDestinationException("http destination URL has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new InvalidDestinationException("Invalid URL in http destination: " + url, e);
        }
        return new SinkTarget.HttpPost(url, jsonField(fields, 1, json));
    }

    private SinkTarget parseS3(String rest, boolean json) {
        String[] fields = split("s3", rest, 3, json);
        return new SinkTarget.S3Object(
            required("s3", "region", fields[0]),
            required("s3", "bucket", fields[1]),
            required("s3", "key", fields[2]),
            jsonField(fields, 3, json));
    }

    private SinkTarget parseSecretsManager(String rest, boolean json) {
        String[] fields = split("secretsmanager", rest, 2, json);
        return new SinkTarget.SecretsManagerSecret(
            required("secretsmanager", "region", fields[0]),
            required("secretsmanager", "secret id", fields[1]),
            jsonField(fields, 2, json));
    }

    private SinkTarget parseSns(String rest, boolean json) {
        String[] fields = split("sns", rest, 2, json);
        return new SinkTarget.SnsTopic(
            required("sns", "region", fields[0]),
            required("sns", "topic ARN", fields[1]),
            jsonField(fields, 2, json));
    }

    private SinkTarget parseSqs(String rest, boolean json) {
        String[] fields = split("sqs", rest, 2, json);
        return new SinkTarget.SqsQueue(
            required("sqs", "region", fields[0]),
            required("sqs", "queue URL", fields[1]),
            jsonField(fields, 2, json));
    }

    private SinkTarget parseSsm(String rest, boolean json) {
        String[] fields = split("ssm", rest, 2, json);
        return new SinkTarget.SsmParameter(
            required("ssm", "region", fields[0]),
            required("ssm", "parameter name", fields[1]),
            jsonField(fields, 2, json));
    }

    private SinkTarget parseDynamoDb(String rest, boolean json) {
        String[] fields = split("dynamodb", rest, 7, json);
        String sortKey = fields[4];
        String sortValue = fields[5];
        if (sortKey.isEmpty() != sortValue.isEmpty()) {
            throw new InvalidDestinationException(
                "dynamodb destination needs both a sort key and a sort value, or neither");
        }
        String hashKey = required("dynamodb", "hash key", fields[2]);
        String payloadAttribute = required("dynamodb", "payload attribute", fields[6]);
        Set<String> attributeNames = new HashSet<>();
        attributeNames.add(hashKey);
        attributeNames.add(payloadAttribute);
        if (!sortKey.isEmpty()) {
            attributeNames.add(sortKey);
        }
        if (attributeNames.size() != (sortKey.isEmpty() ? 2 : 3)) {
            throw new InvalidDestinationException(
                "dynamodb destination needs distinct hash key, sort key and payload attribute names");
        }
        return new SinkTarget.DynamoDbItem(
            required("dynamodb", "region", fields[0]),
            required("dynamodb", "table", fields[1]),
            hashKey,
            required("dynamodb", "hash value", fields[3]),
            sortKey.isEmpty() ? null : sortKey,
            sortValue.isEmpty() ? null : sortValue,
            payloadAttribute,
            jsonField(fields, 7, json));
    }

    /**
     * Splits the fields after the prefix. JSON variants may carry one extra
     * trailing field with the JSON property name.
     */
    private String[] split(String kind, String rest, int required, boolean json) {
        String[] fields = rest.split(DELIMITER, -1);
        boolean validCount = fields.length == required || (json && fields.length == required + 1);
        if (!validCount) {
            throw new InvalidDestinationException(String.format(
                "%s destination expects %d '|'-separated field(s)%s, got %d",
                kind, required, json ? " plus an optional JSON field name" : "", fields.length));
        }
        return fields;
    }

    private String required(String kind, String name, String value) {
        if (value.isBlank()) {
            throw new InvalidDestinationException(kind + " destination is missing its " + name);
        }
        return value;
    }

    private String jsonField(String[] fields, int index, boolean json) {
        if (!json) {
            return null;
        }
        if (fields.length > index && !fields[index].isBlank()) {
            return fields[index];
        }
        return defaultJsonField;
    }
}
