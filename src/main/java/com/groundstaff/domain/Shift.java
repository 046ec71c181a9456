package com.groundstaff.domain;

import java.time.LocalDateTime;

/**
 * One availability window of a staff member.
 */
public final class Shift {

    private final TimeWindow window;

    public Shift(LocalDateTime start, LocalDateTime end) {
        this.window = new TimeWindow(start, end);
    }

    public boolean covers(TimeWindow serviceWindow) {
        return window.covers(serviceWindow);
    }

    public TimeWindow getWindow() { return window; }
    public LocalDateTime getStart() { return window.getStart(); }
    public LocalDateTime getEnd() { return window.getEnd(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return window.equals(((Shift) o).window);
    }

    @Override
    public int hashCode() {
        return window.hashCode();
    }

    @Override
    public String toString() {
        return "Shift" + window;
    }
}
