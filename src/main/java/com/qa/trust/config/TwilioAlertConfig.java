package com.qa.trust.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Optional SMS / WhatsApp transport for detection alerts.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioAlertConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private boolean enabled = false;
    // "sms" or "whatsapp"
    private String channel = "sms";
    // Skip alerts whose snapshot holds no critical detection.
    private boolean criticalOnly = false;
    private int maxPatternsInMessage = 3;
}
