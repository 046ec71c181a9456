package com.groundstaff.domain;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A service boundary expressed relative to the flight, e.g. "A+10" (ten minutes after arrival)
 * or "D-15" (fifteen minutes before departure). Plain "A" and "D" mean the exact time.
 */
public final class RelativeTime {

    private static final Pattern FORMAT = Pattern.compile("^\\s*([AD])\\s*(?:([+-])\\s*(\\d+))?\\s*$");

    public enum Anchor { ARRIVAL, DEPARTURE }

    private final Anchor anchor;
    private final int offsetMinutes;

    public RelativeTime(Anchor anchor, int offsetMinutes) {
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.offsetMinutes = offsetMinutes;
    }

    public static RelativeTime parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Service time is missing");
        }
        Matcher m = FORMAT.matcher(text.toUpperCase());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid service time format: " + text);
        }
        Anchor anchor = "A".equals(m.group(1)) ? Anchor.ARRIVAL : Anchor.DEPARTURE;
        int offset = 0;
        if (m.group(2) != null) {
            offset = Integer.parseInt(m.group(3));
            if ("-".equals(m.group(2))) {
                offset = -offset;
            }
        }
        return new RelativeTime(anchor, offset);
    }

    public LocalDateTime resolve(LocalDateTime arrival, LocalDateTime departure) {
        LocalDateTime base = anchor == Anchor.ARRIVAL ? arrival : departure;
        return base.plusMinutes(offsetMinutes);
    }

    public Anchor getAnchor() { return anchor; }
    public int getOffsetMinutes() { return offsetMinutes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RelativeTime that = (RelativeTime) o;
        return offsetMinutes == that.offsetMinutes && anchor == that.anchor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anchor, offsetMinutes);
    }

    @Override
    public String toString() {
        String base = anchor == Anchor.ARRIVAL ? "A" : "D";
        if (offsetMinutes == 0) {
            return base;
        }
        return base + (offsetMinutes > 0 ? "+" : "-") + Math.abs(offsetMinutes);
    }
}
