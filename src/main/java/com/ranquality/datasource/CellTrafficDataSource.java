package com.ranquality.datasource;

import com.ranquality.domain.change.CellMetadata;
import com.ranquality.domain.period.TrafficActivePeriod;
import com.ranquality.domain.period.TrafficPresenceDay;

import java.util.List;
import java.util.Optional;

public interface CellTrafficDataSource {

    /** Daily presence rows for a cell; a null vendor means every vendor reporting the cell. */
    List<TrafficPresenceDay> getTrafficPresence(String cellId, String vendor);

    /**
     * Periods already computed upstream for a cell, as stored. They may
     * overlap; an empty list means none were stored.
     */
    List<TrafficActivePeriod> getStoredPeriods(String cellId);

    Optional<CellMetadata> getCellMetadata(String cellId);

    List<CellMetadata> getCellsForSite(String site);
}
