package com.ranquality.domain.change;

import com.ranquality.domain.metric.Technology;

public record CellMetadata(String cellId, String site, String band, String vendor, Technology technology) {
}
