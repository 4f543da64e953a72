package com.ranquality.service;

import com.ranquality.domain.change.CellMetadata;
import com.ranquality.domain.period.TrafficActivePeriod;

import java.util.List;

/** Detected periods of one cell; {@code cell} is null when the cell is not in the inventory. */
public record CellPeriods(String cellId, CellMetadata cell, List<TrafficActivePeriod> periods) {

    public CellPeriods {
        periods = List.copyOf(periods);
    }
}
