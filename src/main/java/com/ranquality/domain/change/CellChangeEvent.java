package com.ranquality.domain.change;

import com.ranquality.domain.metric.Technology;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Cell inventory of a site on a day where it changed. {@code bucketCounts}
 * holds only non-empty buckets and always sums to {@code totalCount}.
 */
public record CellChangeEvent(
    String site,
    Technology technology,
    LocalDate date,
    int addedCount,
    int removedCount,
    int totalCount,
    SortedMap<String, Integer> bucketCounts,
    String remark
) {
    public CellChangeEvent {
        bucketCounts = Collections.unmodifiableSortedMap(new TreeMap<>(bucketCounts));
    }

    public boolean isChange() {
        return addedCount > 0 || removedCount > 0;
    }
}
