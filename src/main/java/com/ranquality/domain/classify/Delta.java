package com.ranquality.domain.classify;

import com.ranquality.domain.aggregate.WindowAggregate;
import com.ranquality.domain.window.WindowName;

/** Relative change between two window means; {@code ratio} is null when either mean is undefined. */
public record Delta(WindowName fromWindow, WindowName toWindow, Double ratio) {

    public static Delta between(WindowAggregate from, WindowAggregate to, double eps) {
        if (!from.isDefined() || !to.isDefined()) {
            return new Delta(from.window().name(), to.window().name(), null);
        }
        double ratio = (to.mean() - from.mean()) / Math.max(Math.abs(from.mean()), eps);
        return new Delta(from.window().name(), to.window().name(), ratio);
    }

    public boolean isDefined() {
        return ratio != null;
    }
}
