package com.ranquality.domain.metric;

import java.util.Arrays;
import java.util.List;

/**
 * Indicators evaluated around an input date. Neighbor metrics arrive already
 * aggregated across the neighbor set of the site.
 */
public enum TrackedMetric {
    SITE_UMTS_CQI(MetricScope.SITE, Technology.UMTS, "umts_cqi"),
    SITE_LTE_CQI(MetricScope.SITE, Technology.LTE, "lte_cqi"),
    SITE_NR_CQI(MetricScope.SITE, Technology.NR, "nr_cqi"),
    SITE_DATA_TRAFFIC(MetricScope.SITE, null, "data_traffic_gb"),
    SITE_VOICE_TRAFFIC(MetricScope.SITE, null, "voice_traffic_erl"),
    NEIGHBOR_UMTS_CQI(MetricScope.NEIGHBOR, Technology.UMTS, "umts_cqi"),
    NEIGHBOR_LTE_CQI(MetricScope.NEIGHBOR, Technology.LTE, "lte_cqi"),
    NEIGHBOR_NR_CQI(MetricScope.NEIGHBOR, Technology.NR, "nr_cqi"),
    NEIGHBOR_DATA_TRAFFIC(MetricScope.NEIGHBOR, null, "data_traffic_gb"),
    NEIGHBOR_VOICE_TRAFFIC(MetricScope.NEIGHBOR, null, "voice_traffic_erl");

    private final MetricScope scope;
    private final Technology technology;
    private final String kpiKey;

    TrackedMetric(MetricScope scope, Technology technology, String kpiKey) {
        this.scope = scope;
        this.technology = technology;
        this.kpiKey = kpiKey;
    }

    public MetricScope scope() {
        return scope;
    }

    /** Null for traffic metrics, which are summed across technologies. */
    public Technology technology() {
        return technology;
    }

    /** Column / query key shared by the site table and the neighbor service. */
    public String kpiKey() {
        return kpiKey;
    }

    public static List<TrackedMetric> inScope(boolean includeNeighbors) {
        return Arrays.stream(values())
            .filter(m -> includeNeighbors || m.scope == MetricScope.SITE)
            .toList();
    }
}
