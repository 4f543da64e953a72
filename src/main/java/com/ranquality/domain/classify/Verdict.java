package com.ranquality.domain.classify;

public enum Verdict {
    PASS,
    FAIL,
    RESTORED,
    INCONCLUSIVE
}
