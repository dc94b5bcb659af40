package com.wpanther.kmscert.output;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a finished certificate to exactly one destination
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutputSinkService {

    private final CertificatePayloadFormatter payloadFormatter;
    private final LocalSinkWriter localSinkWriter;
    private final HttpSinkWriter httpSinkWriter;
    private final S3SinkWriter s3SinkWriter;
    private final SecretsManagerSinkWriter secretsManagerSinkWriter;
    private final SnsSinkWriter snsSinkWriter;
    private final SqsSinkWriter sqsSinkWriter;
    private final SsmSinkWriter ssmSinkWriter;
    private final DynamoDbSinkWriter dynamoDbSinkWriter;

    public void write(SinkTarget target, String certificatePem) {
        String payload = payloadFormatter.format(target, certificatePem);
        log.debug("Writing certificate to {} destination", target.getKind());

        target.accept(new SinkTarget.Visitor<Void>() {

            @Override
            public Void visitStdout(SinkTarget.Stdout stdout) {
                localSinkWriter.writeStdout(payload);
                return null;
            }

            @Override
            public Void visitLocalFile(SinkTarget.LocalFile file) {
                localSinkWriter.writeFile(file.getPath(), payload);
                return null;
            }

            @Override
            public Void visitHttpPost(SinkTarget.HttpPost http) {
                httpSinkWriter.write(http, payload);
                return null;
            }

            @Override
            public Void visitS3Object(SinkTarget.S3Object s3) {
                s3SinkWriter.write(s3, payload);
                return null;
            }

            @Override
            public Void visitSecretsManagerSecret(SinkTarget.SecretsManagerSecret secret) {
                secretsManagerSinkWriter.write(secret, payload);
                return null;
            }

            @Override
            public Void visitSnsTopic(SinkTarget.SnsTopic topic) {
                snsSinkWriter.write(topic, payload);
                return null;
            }

            @Override
            public Void visitSqsQueue(SinkTarget.SqsQueue queue) {
                sqsSinkWriter.write(queue, payload);
                return null;
            }

            @Override
            public Void visitSsmParameter(SinkTarget.SsmParameter parameter) {
                ssmSinkWriter.write(parameter, payload);
                return null;
            }

            @Override
            public Void visitDynamoDbItem(SinkTarget.DynamoDbItem item) {
                dynamoDbSinkWriter.write(item, payload);
                return null;
            }
        });
    }
}
