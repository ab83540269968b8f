package com.qa.trust.engine.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qa.trust.config.TrustConfig;
import com.qa.trust.exception.MalformedReportException;
import com.qa.trust.model.ErrorCategory;
import com.qa.trust.model.ErrorSummary;
import com.qa.trust.model.TestCaseResult;
import com.qa.trust.model.TestOutcome;
import com.qa.trust.model.TestRunReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads raw test-run JSON into a {@link TestRunReport}.
 * <p>
 * Unknown fields are ignored and a missing {@code tests} array yields an empty run.
 * Anything that prevents a case from being well formed fails the whole report.
 */
@Component
public class ReportParser {

    private static final List<String> ID_FIELDS = List.of("id", "nodeid", "name");

    private final ObjectMapper objectMapper;
    private final TrustConfig config;

    public ReportParser(ObjectMapper objectMapper, TrustConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    public TestRunReport parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedReportException("Report is empty");
        }
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedReportException("Report is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public TestRunReport parse(InputStream in) {
        try {
            return fromTree(objectMapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new MalformedReportException("Report is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedReportException("Report could not be read: " + e.getMessage(), e);
        }
    }

    public TestRunReport parse(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException e) {
            throw new MalformedReportException("Report file could not be read: " + path, e);
        }
    }

    public TestRunReport fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedReportException("Report must be a JSON object");
        }

        TestRunReport.TestRunReportBuilder builder = TestRunReport.builder()
                .declaredTotal(optionalInt(root, "total"))
                .declaredPassed(optionalInt(root, "passed"))
                .declaredFailed(optionalInt(root, "failed"))
                .declaredSkipped(optionalInt(root, "skipped"))
                .totalDuration(optionalDouble(root, "duration"));

        JsonNode tests = root.get("tests");
        if (tests == null || tests.isNull()) {
            return builder.build();
        }
        if (!tests.isArray()) {
            throw new MalformedReportException("'tests' must be an array");
        }

        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode node : tests) {
            TestCaseResult testCase = parseCase(node, index);
            if (!seen.add(testCase.getId())) {
                throw new MalformedReportException("Duplicate test id at index " + index + ": " + testCase.getId());
            }
            builder.testCase(testCase);
            index++;
        }
        return builder.build();
    }

    private TestCaseResult parseCase(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new MalformedReportException("Test entry " + index + " is not an object");
        }

        String id = null;
        for (String field : ID_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                id = value.asText();
                break;
            }
        }
        if (id == null) {
            throw new MalformedReportException("Test entry " + index + " has no identifier");
        }

        JsonNode outcomeNode = node.get("outcome");
        if (outcomeNode == null || !outcomeNode.isTextual()) {
            throw new MalformedReportException("Test '" + id + "' has no outcome");
        }
        TestOutcome outcome;
        try {
            outcome = TestOutcome.fromString(outcomeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedReportException("Test '" + id + "': " + e.getMessage(), e);
        }

        double duration = 0.0;
        JsonNode durationNode = node.get("duration");
        if (durationNode != null && !durationNode.isNull()) {
            if (!durationNode.isNumber()) {
                throw new MalformedReportException("Test '" + id + "' has a non-numeric duration");
            }
            duration = durationNode.asDouble();
            if (!Double.isFinite(duration) || duration < 0.0) {
                throw new MalformedReportException("Test '" + id + "' has a negative duration: " + duration);
            }
        }

        return TestCaseResult.builder()
                .id(id)
                .outcome(outcome)
                .duration(duration)
                .error(summarizeError(node.get("error")))
                .build();
    }

    private ErrorSummary summarizeError(JsonNode errorNode) {
        if (errorNode == null || errorNode.isNull()) {
            return null;
        }
        String text;
        if (errorNode.isTextual()) {
            text = errorNode.asText();
        } else if (errorNode.isObject() && errorNode.hasNonNull("message")) {
            text = errorNode.get("message").asText();
        } else {
            text = errorNode.toString();
        }
        if (text.isBlank()) {
            return null;
        }

        // truncate first so classification cost is bounded
        String truncated = truncate(text, config.getRecord().getErrorMessageMaxLength());
        return ErrorSummary.builder()
                .category(ErrorCategory.classify(truncated))
                .message(truncated)
                .build();
    }

    static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    private static Integer optionalInt(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isIntegralNumber() && node.canConvertToInt() ? node.asInt() : null;
    }

    private static Double optionalDouble(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isNumber() ? node.asDouble() : null;
    }
}
