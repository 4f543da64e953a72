package com.ranquality.exception;

public class SiteNotFoundException extends RanQualityException {
    public SiteNotFoundException(String site) {
        super("SITE_NOT_FOUND", "No KPI data found for site '" + site + "'.");
    }
}
