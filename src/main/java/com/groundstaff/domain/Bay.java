package com.groundstaff.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Aircraft stand with travel times (minutes) to the other bays.
 */
public final class Bay {

    private final String number;
    private final Map<String, Integer> travelTimes;

    public Bay(String number, Map<String, Integer> travelTimes) {
        this.number = Objects.requireNonNull(number, "number");
        this.travelTimes = Map.copyOf(travelTimes);
    }

    /** Travel minutes to another bay, or null when the pair is not listed. */
    public Integer travelTimeTo(String otherBay) {
        if (number.equals(otherBay)) {
            return 0;
        }
        return travelTimes.get(otherBay);
    }

    public String getNumber() { return number; }
    public Map<String, Integer> getTravelTimes() { return travelTimes; }

    @Override
    public String toString() {
        return "Bay{" + number + ", " + travelTimes.size() + " routes}";
    }
}
