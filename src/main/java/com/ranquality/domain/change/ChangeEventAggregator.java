package com.ranquality.domain.change;

import com.ranquality.domain.metric.Technology;
import com.ranquality.domain.period.CellKey;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Daily cell inventory of one site and technology, reported only on the days
 * it changes.
 *
 * <p>The calendar spans the earliest period start to the latest period end.
 * Only period boundaries can change the inventory, so the fold walks those
 * dates in order instead of every calendar day: a period adds its cell on
 * {@code initDate} and removes it on {@code endDate + 1}. Cells still live on
 * the last calendar day are at the data horizon and are not removed.
 */
public final class ChangeEventAggregator {

    private ChangeEventAggregator() {
    }

    public static List<CellChangeEvent> aggregate(String site, Technology technology, BucketScheme scheme,
                                                  Collection<PeriodWithMetadata> periods) {
        if (periods.isEmpty()) {
            return List.of();
        }

        LocalDate start = null;
        LocalDate horizon = null;
        Map<CellKey, String> bucketOf = new HashMap<>();
        TreeMap<LocalDate, Map<CellKey, Integer>> transitions = new TreeMap<>();

        for (PeriodWithMetadata p : periods) {
            CellKey key = new CellKey(p.period().cellId(), p.vendor());
            bucketOf.putIfAbsent(key, scheme.bucketFor(p.cell().band(), p.vendor()));
            LocalDate init = p.period().initDate();
            LocalDate end = p.period().endDate();
            start = start == null || init.isBefore(start) ? init : start;
            horizon = horizon == null || end.isAfter(horizon) ? end : horizon;
            transitions.computeIfAbsent(init, d -> new HashMap<>()).merge(key, 1, Integer::sum);
            transitions.computeIfAbsent(end.plusDays(1), d -> new HashMap<>()).merge(key, -1, Integer::sum);
        }

        Map<CellKey, Integer> liveDepth = new HashMap<>();
        SortedMap<String, Integer> buckets = new TreeMap<>();
        int total = 0;
        List<CellChangeEvent> events = new ArrayList<>();

        for (Map.Entry<LocalDate, Map<CellKey, Integer>> transition : transitions.entrySet()) {
            LocalDate date = transition.getKey();
            if (date.isAfter(horizon)) {
                break;
            }
            SortedMap<String, Integer> addedByBucket = new TreeMap<>();
            SortedMap<String, Integer> removedByBucket = new TreeMap<>();

            for (Map.Entry<CellKey, Integer> change : transition.getValue().entrySet()) {
                CellKey key = change.getKey();
                int before = liveDepth.getOrDefault(key, 0);
                int after = before + change.getValue();
                if (after <= 0) {
                    liveDepth.remove(key);
                } else {
                    liveDepth.put(key, after);
                }
                String bucket = bucketOf.get(key);
                if (before == 0 && after > 0) {
                    addedByBucket.merge(bucket, 1, Integer::sum);
                    buckets.merge(bucket, 1, Integer::sum);
                    total++;
                } else if (before > 0 && after <= 0) {
                    removedByBucket.merge(bucket, 1, Integer::sum);
                    buckets.computeIfPresent(bucket, (b, n) -> n > 1 ? n - 1 : null);
                    total--;
                }
            }

            int added = sum(addedByBucket);
            int removed = sum(removedByBucket);
            if (date.equals(start) || added > 0 || removed > 0) {
                events.add(new CellChangeEvent(site, technology, date, added, removed, total,
                    buckets, remark(addedByBucket, removedByBucket)));
            }
        }
        return events;
    }

    /** Days on which cells were added or removed, across all technologies. */
    public static List<LocalDate> recommendedInputDates(Collection<CellChangeEvent> events) {
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (CellChangeEvent event : events) {
            if (event.isChange()) {
                dates.add(event.date());
            }
        }
        return new ArrayList<>(dates);
    }

    static String remark(SortedMap<String, Integer> added, SortedMap<String, Integer> removed) {
        List<String> parts = new ArrayList<>();
        if (!added.isEmpty()) {
            parts.add("add " + describe(added));
        }
        if (!removed.isEmpty()) {
            parts.add("del " + describe(removed));
        }
        return String.join(", ", parts);
    }

    private static String describe(SortedMap<String, Integer> counts) {
        List<String> items = new ArrayList<>();
        counts.forEach((bucket, n) -> items.add(String.format("%02d %s", n, bucket)));
        return String.join(", ", items);
    }

    private static int sum(Map<String, Integer> counts) {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
