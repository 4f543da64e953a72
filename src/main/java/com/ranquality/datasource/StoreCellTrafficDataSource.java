package com.ranquality.datasource;

import com.ranquality.domain.change.CellMetadata;
import com.ranquality.domain.metric.Technology;
import com.ranquality.domain.period.TrafficActivePeriod;
import com.ranquality.domain.period.TrafficPresenceDay;
import com.ranquality.entity.CellInventory;
import com.ranquality.entity.CellTrafficDaily;
import com.ranquality.entity.CellTrafficPeriod;
import com.ranquality.exception.DataSourceUnavailableException;
import com.ranquality.repository.CellInventoryRepository;
import com.ranquality.repository.CellTrafficDailyRepository;
import com.ranquality.repository.CellTrafficPeriodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Component
@RequiredArgsConstructor
public class StoreCellTrafficDataSource implements CellTrafficDataSource {

    static final String CELL_STORE = "cell traffic store";

    private final CellTrafficDailyRepository trafficRepository;
    private final CellInventoryRepository inventoryRepository;
    private final CellTrafficPeriodRepository periodRepository;

    @Override
    public List<TrafficPresenceDay> getTrafficPresence(String cellId, String vendor) {
        List<CellTrafficDaily> rows = read(() -> vendor == null
            ? trafficRepository.findByCellIdOrderByTrafficDateAsc(cellId)
            : trafficRepository.findByCellIdAndVendorOrderByTrafficDateAsc(cellId, vendor));
        return rows.stream()
            .map(r -> TrafficPresenceDay.fromTraffic(r.getCellId(), r.getVendor(), r.getTrafficDate(), r.getTraffic()))
            .toList();
    }

    @Override
    public List<TrafficActivePeriod> getStoredPeriods(String cellId) {
        return read(() -> periodRepository.findByCellIdOrderByInitDateAsc(cellId)).stream()
            .map(this::toPeriod)
            .flatMap(Optional::stream)
            .toList();
    }

    @Override
    public Optional<CellMetadata> getCellMetadata(String cellId) {
        return read(() -> inventoryRepository.findById(cellId)).flatMap(this::toMetadata);
    }

    @Override
    public List<CellMetadata> getCellsForSite(String site) {
        return read(() -> inventoryRepository.findBySiteAttOrderByCellIdAsc(site)).stream()
            .map(this::toMetadata)
            .flatMap(Optional::stream)
            .toList();
    }

    private Optional<TrafficActivePeriod> toPeriod(CellTrafficPeriod row) {
        if (row.getEndDate() == null) {
            log.debug("Skipping open stored period | cell={} | vendor={} | init={}",
                row.getCellId(), row.getVendor(), row.getInitDate());
            return Optional.empty();
        }
        if (row.getEndDate().isBefore(row.getInitDate())) {
            log.warn("Skipping stored period ending before it starts | cell={} | vendor={} | init={} | end={}",
                row.getCellId(), row.getVendor(), row.getInitDate(), row.getEndDate());
            return Optional.empty();
        }
        return Optional.of(TrafficActivePeriod.of(row.getCellId(), row.getVendor(), row.getInitDate(), row.getEndDate()));
    }

    private Optional<CellMetadata> toMetadata(CellInventory row) {
        try {
            return Optional.of(new CellMetadata(row.getCellId(), row.getSiteAtt(), row.getBand(), row.getVendor(),
                Technology.fromLabel(row.getTechnology())));
        } catch (IllegalArgumentException ex) {
            log.warn("Skipping cell with unknown technology | cell={} | technology={}",
                row.getCellId(), row.getTechnology());
            return Optional.empty();
        }
    }

    private static <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            throw new DataSourceUnavailableException(CELL_STORE, ex);
        }
    }
}
