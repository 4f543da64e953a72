package com.ranquality.domain.metric;

public enum MetricScope {
    SITE,
    NEIGHBOR
}
