package com.trading.sdg.api;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Periodic sampling interval of a node, e.g. {@code 1Min}, {@code 4H}, {@code 1D}.
 * <p>
 * Timeframes are totally ordered by their approximate duration so that the
 * coarsest of several intervals can be selected.
 */
public record Timeframe(int multiplier, Unit unit) implements Comparable<Timeframe> {

    public static final Timeframe ONE_MINUTE = new Timeframe(1, Unit.MINUTE);
    public static final Timeframe ONE_DAY = new Timeframe(1, Unit.DAY);

    private static final Pattern PATTERN = Pattern.compile("^(\\d+)\\s*([A-Za-z]+)$");

    /** Supported interval units with their canonical suffix and length in seconds. */
    public enum Unit {
        MINUTE("Min", 60L),
        HOUR("H", 3_600L),
        DAY("D", 86_400L),
        WEEK("W", 7 * 86_400L),
        MONTH("ME", 30 * 86_400L),
        QUARTER("QE", 91 * 86_400L),
        YEAR("YE", 365 * 86_400L);

        private final String suffix;
        private final long seconds;

        Unit(String suffix, long seconds) {
            this.suffix = suffix;
            this.seconds = seconds;
        }

        public String suffix() {
            return suffix;
        }

        public long seconds() {
            return seconds;
        }
    }

    public Timeframe {
        if (multiplier < 1)
            throw new IllegalArgumentException("Timeframe multiplier must be >= 1, got " + multiplier);
        if (unit == null)
            throw new IllegalArgumentException("Timeframe unit is required");
    }

    /**
     * Parses a canonical or lower-case timeframe string.
     *
     * @throws IllegalArgumentException if the text is not a timeframe.
     */
    public static Timeframe parse(String text) {
        if (text == null)
            throw new IllegalArgumentException("Timeframe text is null");
        Matcher m = PATTERN.matcher(text.trim());
        if (!m.matches())
            throw new IllegalArgumentException("Invalid timeframe: '" + text + "'");
        int n = Integer.parseInt(m.group(1));
        String u = m.group(2).toLowerCase(Locale.ROOT);
        Unit unit = switch (u) {
            case "min", "m", "t" -> Unit.MINUTE;
            case "h" -> Unit.HOUR;
            case "d" -> Unit.DAY;
            case "w" -> Unit.WEEK;
            case "me", "mo" -> Unit.MONTH;
            case "qe", "q" -> Unit.QUARTER;
            case "ye", "y" -> Unit.YEAR;
            default -> throw new IllegalArgumentException("Invalid timeframe unit in '" + text + "'");
        };
        return new Timeframe(n, unit);
    }

    public long durationSeconds() {
        return multiplier * unit.seconds;
    }

    public boolean isIntraday() {
        return unit == Unit.MINUTE || unit == Unit.HOUR;
    }

    /** Returns the coarser of the two; {@code null} is treated as unresolved. */
    public static Timeframe coarsest(Timeframe a, Timeframe b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(Timeframe o) {
        int c = Long.compare(durationSeconds(), o.durationSeconds());
        if (c != 0)
            return c;
        // Equal durations (60Min vs 1H) still need a strict order
        return Integer.compare(unit.ordinal(), o.unit.ordinal());
    }

    @Override
    public String toString() {
        return multiplier + unit.suffix;
    }
}
