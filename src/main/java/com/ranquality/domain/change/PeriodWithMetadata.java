package com.ranquality.domain.change;

import com.ranquality.domain.period.TrafficActivePeriod;

public record PeriodWithMetadata(TrafficActivePeriod period, CellMetadata cell) {

    /** The period's vendor wins over the inventory vendor, which may be stale. */
    public String vendor() {
        return period.vendor() != null ? period.vendor() : cell.vendor();
    }
}
