package com.qa.trust.engine.record;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.qa.trust.model.FactSheet;
import com.qa.trust.model.FailedCaseDetail;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical JSON of the hashed part of a record: {@code facts} and {@code failed_case_details}.
 * <p>
 * Keys are sorted at every level, output is compact and decimals are written plainly with at
 * least one fractional digit, so the same facts always produce the same bytes.
 */
@Component
public class CanonicalSerializer {

    private final ObjectMapper canonicalMapper;

    public CanonicalSerializer(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    public String canonicalize(FactSheet facts, List<FailedCaseDetail> failedCaseDetails) {
        Map<String, Object> factMap = new TreeMap<>();
        factMap.put("total_test_count", facts.getTotalTestCount());
        factMap.put("passed_count", facts.getPassedCount());
        factMap.put("failed_count", facts.getFailedCount());
        factMap.put("skipped_count", facts.getSkippedCount());
        factMap.put("exact_success_rate", normalizeRate(facts.getExactSuccessRate()));
        factMap.put("deployment_allowed", facts.isDeploymentAllowed());

        List<Map<String, Object>> details = new ArrayList<>();
        if (failedCaseDetails != null) {
            for (FailedCaseDetail detail : failedCaseDetails) {
                Map<String, Object> entry = new TreeMap<>();
                entry.put("name", detail.getName());
                entry.put("error_category", detail.getErrorCategory() == null
                        ? null : detail.getErrorCategory().getCode());
                details.add(entry);
            }
        }

        Map<String, Object> root = new TreeMap<>();
        root.put("facts", factMap);
        root.put("failed_case_details", details);

        try {
            return canonicalMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical serialization failed", e);
        }
    }

    public String hash(FactSheet facts, List<FailedCaseDetail> failedCaseDetails) {
        return Sha256.hex(canonicalize(facts, failedCaseDetails));
    }

    /**
     * Strips trailing zeros but keeps one fractional digit: 90.00 -> 90.0, 33.330 -> 33.33.
     */
    public static BigDecimal normalizeRate(BigDecimal rate) {
        if (rate == null) {
            return null;
        }
        BigDecimal stripped = rate.stripTrailingZeros();
        return stripped.scale() < 1 ? stripped.setScale(1) : stripped;
    }
}
