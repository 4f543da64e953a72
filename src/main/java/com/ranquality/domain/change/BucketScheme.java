package com.ranquality.domain.change;

import com.ranquality.domain.metric.Technology;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps a cell's band indicator and vendor onto a {@code band_vendor} bucket
 * key such as {@code b2_h3g}. Anything not listed lands in the catch-all band
 * {@code x} and/or the catch-all vendor code.
 */
public final class BucketScheme {

    public static final String UNKNOWN_BAND = "x";

    private final Technology technology;
    private final Map<String, String> bands;
    private final Map<String, String> vendors;
    private final String unknownVendor;

    public BucketScheme(Technology technology, Map<String, String> bands, Map<String, String> vendors,
                        String unknownVendor) {
        this.technology = technology;
        this.bands = normalise(bands);
        this.vendors = normalise(vendors);
        this.unknownVendor = unknownVendor;
    }

    public Technology technology() {
        return technology;
    }

    public String bucketFor(String band, String vendor) {
        String bandCode = band == null ? UNKNOWN_BAND : bands.getOrDefault(key(band), UNKNOWN_BAND);
        String vendorCode = vendor == null ? unknownVendor : vendors.getOrDefault(key(vendor), unknownVendor);
        return bandCode + "_" + vendorCode;
    }

    public static BucketScheme umts() {
        return new BucketScheme(Technology.UMTS,
            Map.of("band_2_pcs", "b2", "band_4_aws", "b4", "band_5_850", "b5"),
            Map.of("huawei", "h3g", "ericsson", "e3g", "nokia", "n3g"),
            "x3g");
    }

    public static BucketScheme lte() {
        Map<String, String> bands = new TreeMap<>();
        bands.put("band_2_pcs", "b2");
        bands.put("band_4_aws", "b4");
        bands.put("band_5_850", "b5");
        bands.put("band_7_2600", "b7");
        bands.put("band_26_850", "b26");
        bands.put("band_42_3500", "b42");
        return new BucketScheme(Technology.LTE, bands,
            Map.of("huawei", "h4g", "ericsson", "e4g", "nokia", "n4g", "samsung", "s4g"),
            "x4g");
    }

    /** Everything in one catch-all bucket, for technologies without a configured scheme. */
    public static BucketScheme catchAll(Technology technology) {
        return new BucketScheme(technology, Map.of(), Map.of(), "x" + technology.name().toLowerCase(Locale.ROOT));
    }

    private static Map<String, String> normalise(Map<String, String> source) {
        Map<String, String> result = new TreeMap<>();
        if (source != null) {
            source.forEach((k, v) -> result.put(key(k), v));
        }
        return result;
    }

    private static String key(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
