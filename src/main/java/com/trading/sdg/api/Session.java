package com.trading.sdg.api;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Trading session a node is restricted to: either a named market session or an
 * explicit intraday time range (UTC).
 */
public record Session(String name, LocalTime start, LocalTime end, ZoneId zone) {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    // Named session lookup table
    private static final Map<String, Session> NAMED = Map.of(
            "Sydney", new Session("Sydney", LocalTime.of(8, 0), LocalTime.of(17, 0), ZoneId.of("Australia/Sydney")),
            "Tokyo", new Session("Tokyo", LocalTime.of(9, 0), LocalTime.of(18, 0), ZoneId.of("Asia/Tokyo")),
            "London", new Session("London", LocalTime.of(8, 0), LocalTime.of(17, 0), ZoneId.of("Europe/London")),
            "NewYork", new Session("NewYork", LocalTime.of(9, 30), LocalTime.of(16, 0), NEW_YORK),
            "AsianKillZone", new Session("AsianKillZone", LocalTime.of(19, 0), LocalTime.of(23, 0), NEW_YORK),
            "LondonOpenKillZone", new Session("LondonOpenKillZone", LocalTime.of(2, 0), LocalTime.of(5, 0), NEW_YORK),
            "NewYorkKillZone", new Session("NewYorkKillZone", LocalTime.of(7, 0), LocalTime.of(10, 0), NEW_YORK),
            "LondonCloseKillZone", new Session("LondonCloseKillZone", LocalTime.of(10, 0), LocalTime.of(12, 0), NEW_YORK));

    public static Session named(String name) {
        Session s = NAMED.get(name);
        if (s == null)
            throw new IllegalArgumentException("Unknown session '" + name + "'. Known sessions: " + NAMED.keySet());
        return s;
    }

    public static boolean isNamed(String name) {
        return NAMED.containsKey(name);
    }

    /**
     * Explicit UTC range.
     *
     * @throws IllegalArgumentException if {@code start} is after {@code end}.
     */
    public static Session range(LocalTime start, LocalTime end) {
        if (start.isAfter(end))
            throw new IllegalArgumentException("Session start " + start + " is after end " + end);
        return new Session(null, start, end, ZoneOffset.UTC);
    }

    /**
     * Parses either a session name or a range written as {@code HH:mm-HH:mm}.
     */
    public static Session parse(String text) {
        String t = text.trim();
        if (isNamed(t))
            return named(t);
        int dash = t.indexOf('-');
        if (dash < 0)
            return named(t);
        try {
            return range(LocalTime.parse(t.substring(0, dash).trim()), LocalTime.parse(t.substring(dash + 1).trim()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid session range '" + text + "'", e);
        }
    }

    public boolean isNamed() {
        return name != null;
    }

    /** Whether the local time falls in {@code [start, end)}. */
    public boolean contains(LocalTime t) {
        return !t.isBefore(start) && t.isBefore(end);
    }

    @Override
    public String toString() {
        return name != null ? name : start + "-" + end;
    }
}
