package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrustTier {
    TRUSTED,
    SUSPICIOUS,
    DECEPTIVE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TrustTier fromTrustScore(double trustScore, double trustedThreshold, double suspiciousThreshold) {
        if (trustScore >= trustedThreshold) return TRUSTED;
        if (trustScore >= suspiciousThreshold) return SUSPICIOUS;
        return DECEPTIVE;
    }
}
