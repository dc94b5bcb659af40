package com.wpanther.kmscert.output;

import java.util.Collections;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.RequiredArgsConstructor;

/**
 * Renders the certificate as the body a destination receives
 */
@Component
@RequiredArgsConstructor
public class CertificatePayloadFormatter {

    private final ObjectMapper objectMapper;

    public String format(SinkTarget target, String certificatePem) {
        if (!target.isJson()) {
            return certificatePem;
        }
        try {
            return objectMapper.writeValueAsString(Collections.singletonMap(target.getJsonField(), certificatePem));
        } catch (JsonProcessingException e) {
            throw new SinkWriteException("Failed to wrap certificate as JSON: " + e.getMessage(), e);
        }
    }
}
