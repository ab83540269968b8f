package com.qa.trust.engine.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.VerificationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-derives a record's binding hash from its own facts and compares it to the stored one.
 * Tampering is a result, never an exception.
 */
@Component
public class HashVerifier {

    private static final Logger log = LoggerFactory.getLogger(HashVerifier.class);

    private final CanonicalSerializer canonicalSerializer;
    private final ObjectMapper objectMapper;

    public HashVerifier(CanonicalSerializer canonicalSerializer, ObjectMapper objectMapper) {
        this.canonicalSerializer = canonicalSerializer;
        this.objectMapper = objectMapper;
    }

    public boolean verify(ImmutableRecord record) {
        return check(record).isValid();
    }

    public boolean verify(String recordJson) {
        return check(recordJson).isValid();
    }

    public VerificationOutcome check(String recordJson) {
        ImmutableRecord record;
        try {
            record = objectMapper.readValue(recordJson, ImmutableRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Record could not be read for verification: {}", e.getMessage());
            return VerificationOutcome.builder()
                    .valid(false)
                    .reason("unreadable record: " + e.getMessage())
                    .build();
        }
        return check(record);
    }

    public VerificationOutcome check(ImmutableRecord record) {
        if (record == null || record.getFacts() == null || record.getBindingHash() == null) {
            return VerificationOutcome.builder()
                    .valid(false)
                    .reason("record is missing facts or verification hash")
                    .build();
        }

        String expected = canonicalSerializer.hash(record.getFacts(), record.getFailedCaseDetails());
        String actual = record.getBindingHash();
        boolean valid = expected.equals(actual);
        if (!valid) {
            log.warn("Binding hash mismatch: stored={}, recomputed={}", actual, expected);
        }
        return VerificationOutcome.builder()
                .valid(valid)
                .expectedHash(expected)
                .actualHash(actual)
                .reason(valid ? null : "binding hash does not match facts")
                .build();
    }
}
