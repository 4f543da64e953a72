package com.ranquality.domain.classify;

/**
 * The nine (Before-&gt;After, After-&gt;Last) combinations, numbered in
 * lexicographic order over Increase &lt; Stable &lt; Decrease.
 */
public enum PatternType {
    T1(ChangeClass.INCREASE, ChangeClass.INCREASE),
    T2(ChangeClass.INCREASE, ChangeClass.STABLE),
    T3(ChangeClass.INCREASE, ChangeClass.DECREASE),
    T4(ChangeClass.STABLE, ChangeClass.INCREASE),
    T5(ChangeClass.STABLE, ChangeClass.STABLE),
    T6(ChangeClass.STABLE, ChangeClass.DECREASE),
    T7(ChangeClass.DECREASE, ChangeClass.INCREASE),
    T8(ChangeClass.DECREASE, ChangeClass.STABLE),
    T9(ChangeClass.DECREASE, ChangeClass.DECREASE);

    private final ChangeClass beforeAfter;
    private final ChangeClass afterLast;

    PatternType(ChangeClass beforeAfter, ChangeClass afterLast) {
        this.beforeAfter = beforeAfter;
        this.afterLast = afterLast;
    }

    public ChangeClass beforeAfter() {
        return beforeAfter;
    }

    public ChangeClass afterLast() {
        return afterLast;
    }

    /** Two-letter code such as {@code "DI"}. */
    public String code() {
        return "" + beforeAfter.code() + afterLast.code();
    }

    public static PatternType of(ChangeClass beforeAfter, ChangeClass afterLast) {
        return values()[beforeAfter.ordinal() * ChangeClass.values().length + afterLast.ordinal()];
    }
}
