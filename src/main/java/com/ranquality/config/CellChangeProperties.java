package com.ranquality.config;

import com.ranquality.domain.change.BucketScheme;
import com.ranquality.domain.metric.Technology;
import com.ranquality.domain.period.PeriodDetector;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Period detection and change-event bucketing.
 * Maps to the 'cell-change' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "cell-change")
public class CellChangeProperties {

    private int minRun = PeriodDetector.DEFAULT_MIN_RUN;
    private Map<String, Buckets> buckets = new LinkedHashMap<>();

    @Data
    public static class Buckets {
        private Map<String, String> bands = new LinkedHashMap<>();
        private Map<String, String> vendors = new LinkedHashMap<>();
        private String unknownVendor;
    }

    public BucketScheme schemeFor(Technology technology) {
        Buckets configured = buckets.get(technology.name().toLowerCase(Locale.ROOT));
        if (configured == null) {
            return switch (technology) {
                case UMTS -> BucketScheme.umts();
                case LTE -> BucketScheme.lte();
                case NR -> BucketScheme.catchAll(technology);
            };
        }
        String unknownVendor = configured.getUnknownVendor() != null
            ? configured.getUnknownVendor()
            : "x" + technology.name().toLowerCase(Locale.ROOT);
        return new BucketScheme(technology, configured.getBands(), configured.getVendors(), unknownVendor);
    }
}
