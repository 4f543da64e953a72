package com.ranquality.domain.period;

import java.util.Comparator;
import java.util.Objects;

/** A cell as reported by one vendor. */
public record CellKey(String cellId, String vendor) implements Comparable<CellKey> {

    private static final Comparator<CellKey> ORDER = Comparator
        .comparing(CellKey::cellId)
        .thenComparing(CellKey::vendor, Comparator.nullsFirst(Comparator.naturalOrder()));

    public CellKey {
        Objects.requireNonNull(cellId, "cellId");
    }

    @Override
    public int compareTo(CellKey other) {
        return ORDER.compare(this, other);
    }
}
