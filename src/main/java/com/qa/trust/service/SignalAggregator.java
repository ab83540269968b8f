package com.qa.trust.service;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.DeceptionScore;
import com.qa.trust.model.SignalBundle;
import com.qa.trust.model.SignalType;
import com.qa.trust.model.TrustTier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines a project's signal bundle into a deception score.
 * <p>
 * overall = Σ(weight × normalized signal), where ratios are used as-is and counts are
 * normalized as min(count / cap, 1). Weights are non-negative, so raising any single
 * signal can never lower the overall score.
 */
@Service
public class SignalAggregator {

    private final TrustConfig config;
    private final Clock clock;

    public SignalAggregator(TrustConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        config.getSignals().getWeights().validate();
        config.getTiers().validate();
    }

    public DeceptionScore aggregate(String project, SignalBundle bundle) {
        Map<SignalType, Double> weights = config.getSignals().getWeights().asMap();
        double indicatorThreshold = config.getSignals().getIndicatorThreshold();

        Map<SignalType, Double> contributions = new EnumMap<>(SignalType.class);
        List<SignalType> indicators = new ArrayList<>();
        double overall = 0.0;

        for (SignalType type : SignalType.values()) {
            double normalized = normalize(type, bundle);
            double contribution = weights.get(type) * normalized;
            contributions.put(type, round4(contribution));
            overall += contribution;

            // a single passing honeypot is already evidence of gaming
            if (normalized > indicatorThreshold
                    || (type == SignalType.HONEYPOT_VIOLATION && normalized > 0.0)) {
                indicators.add(type);
            }
        }

        double overallScore = round4(clamp(overall));
        double trustScore = round4(clamp(1.0 - overallScore));
        TrustTier tier = TrustTier.fromTrustScore(trustScore,
                config.getTiers().getTrusted(), config.getTiers().getSuspicious());

        return DeceptionScore.builder()
                .project(project)
                .overallDeceptionScore(overallScore)
                .trustScore(trustScore)
                .tier(tier)
                .contributions(contributions)
                .indicators(List.copyOf(indicators))
                .computedAt(clock.millis())
                .build();
    }

    public double normalize(SignalType type, SignalBundle bundle) {
        double raw = bundle.valueOf(type);
        if (!type.isCount()) {
            return raw;
        }
        double cap = config.getSignals().getCountNormalizationCap();
        return Math.min(raw / cap, 1.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
