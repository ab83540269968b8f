package com.qa.trust.service;

import com.qa.trust.config.MetricsConfig;
import com.qa.trust.config.TwilioAlertConfig;
import com.qa.trust.model.Alert;
import com.qa.trust.model.Severity;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Forwards alerts over SMS or WhatsApp. Registered as an {@link AlertCallback}; does nothing
 * unless {@code twilio.enabled=true}.
 */
@Component
public class TwilioAlertNotifier implements AlertCallback {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertNotifier.class);

    private final TwilioAlertConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioAlertNotifier(TwilioAlertConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert notifier initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio alert notifier is DISABLED.");
        }
    }

    @Override
    public void onAlert(Alert alert) {
        if (!config.isEnabled()) {
            return;
        }
        if (config.isCriticalOnly()
                && alert.getSeverityBreakdown().getOrDefault(Severity.CRITICAL, 0L) == 0L) {
            log.debug("Skipping non-critical alert for project {}", alert.getProject());
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio alert sent for project={}, sid={}", alert.getProject(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio alert for project={}: {}", alert.getProject(), e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "twilio-" + config.getChannel();
    }

    String buildMessageBody(Alert alert) {
        String topPatterns = alert.getPatternBreakdown().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(config.getMaxPatternsInMessage())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));

        return String.format(
                "[TRUST ALERT] Untrustworthy test reporting\n" +
                "Project: %s\n" +
                "Detections: %d (threshold %d)\n" +
                "Total checks: %d\n" +
                "Critical: %d\n" +
                "Top patterns: %s",
                alert.getProject(),
                alert.getHallucinationCount(),
                alert.getThreshold(),
                alert.getTotalChecks(),
                alert.getSeverityBreakdown().getOrDefault(Severity.CRITICAL, 0L),
                topPatterns.isEmpty() ? "N/A" : topPatterns
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
