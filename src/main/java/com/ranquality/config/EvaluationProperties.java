package com.ranquality.config;

import com.ranquality.domain.classify.PatternClassifier;
import com.ranquality.domain.classify.VerdictPolicyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Defaults and limits for KPI pattern evaluation.
 * Maps to the 'evaluation' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "evaluation")
public class EvaluationProperties {

    private double defaultThreshold = 0.05;
    private int defaultPeriod = 7;
    private int defaultGuard = 7;
    private double eps = PatternClassifier.DEFAULT_EPS;
    private VerdictPolicyType verdictPolicy = VerdictPolicyType.PRIOR_DEGRADATION;
    private boolean neighborsEnabled = true;
    private boolean annotateChangeEvents = true;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private int maxBatchSize = 50;
    private Fetch fetch = new Fetch();

    @Data
    public static class Fetch {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(200);
    }
}
