package com.ranquality.domain.classify;

public enum VerdictPolicyType {
    PRIOR_DEGRADATION,
    LATE_DECREASE
}
