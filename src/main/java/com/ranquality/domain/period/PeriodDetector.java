package com.ranquality.domain.period;

import com.ranquality.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds maximal runs of consecutive active days per cell and vendor.
 *
 * <p>Active days are grouped by {@code epochDay - rank}: two days share a run
 * id exactly when no day is missing between them. Runs shorter than
 * {@code minRun} are discarded.
 */
@Slf4j
public final class PeriodDetector {

    public static final int DEFAULT_MIN_RUN = 3;

    private PeriodDetector() {
    }

    public static List<TrafficActivePeriod> detect(Collection<TrafficPresenceDay> days, int minRun) {
        if (minRun < 1) {
            throw new InvalidConfigurationException("minRun must be >= 1, got " + minRun);
        }
        Map<CellKey, SortedSet<LocalDate>> activeDays = new TreeMap<>();
        for (TrafficPresenceDay day : days) {
            if (day.hasTraffic()) {
                activeDays.computeIfAbsent(new CellKey(day.cellId(), day.vendor()), k -> new TreeSet<>())
                    .add(day.date());
            }
        }

        List<TrafficActivePeriod> periods = new ArrayList<>();
        activeDays.forEach((key, dates) -> periods.addAll(runsOf(key, dates, minRun)));
        return periods;
    }

    private static List<TrafficActivePeriod> runsOf(CellKey key, SortedSet<LocalDate> dates, int minRun) {
        Map<Long, List<LocalDate>> runs = new LinkedHashMap<>();
        long rank = 0;
        for (LocalDate date : dates) {
            runs.computeIfAbsent(date.toEpochDay() - rank, r -> new ArrayList<>()).add(date);
            rank++;
        }
        List<TrafficActivePeriod> periods = new ArrayList<>();
        for (List<LocalDate> run : runs.values()) {
            if (run.size() >= minRun) {
                periods.add(TrafficActivePeriod.of(key.cellId(), key.vendor(), run.get(0), run.get(run.size() - 1)));
            }
        }
        return periods;
    }

    /**
     * Cleans periods read from upstream storage. When two periods of the same
     * cell and vendor overlap, the later-starting one is kept whole and the
     * earlier one is cut back to the day before it (or dropped when nothing is
     * left). Periods are never merged.
     */
    public static List<TrafficActivePeriod> resolveOverlaps(Collection<TrafficActivePeriod> periods) {
        Map<CellKey, List<TrafficActivePeriod>> byKey = new TreeMap<>();
        for (TrafficActivePeriod p : periods) {
            byKey.computeIfAbsent(p.key(), k -> new ArrayList<>()).add(p);
        }

        List<TrafficActivePeriod> resolved = new ArrayList<>();
        byKey.forEach((key, group) -> {
            group.sort(Comparator.comparing(TrafficActivePeriod::initDate)
                .thenComparing(TrafficActivePeriod::endDate));
            List<TrafficActivePeriod> kept = new ArrayList<>();
            for (TrafficActivePeriod next : group) {
                while (!kept.isEmpty() && !kept.get(kept.size() - 1).endDate().isBefore(next.initDate())) {
                    TrafficActivePeriod previous = kept.remove(kept.size() - 1);
                    log.warn("Overlapping traffic periods | cell={} | vendor={} | kept={}..{} | truncated={}..{}",
                        key.cellId(), key.vendor(), next.initDate(), next.endDate(),
                        previous.initDate(), previous.endDate());
                    LocalDate cut = next.initDate().minusDays(1);
                    if (!cut.isBefore(previous.initDate())) {
                        kept.add(TrafficActivePeriod.of(previous.cellId(), previous.vendor(), previous.initDate(), cut));
                    }
                }
                kept.add(next);
            }
            resolved.addAll(kept);
        });
        return resolved;
    }
}
