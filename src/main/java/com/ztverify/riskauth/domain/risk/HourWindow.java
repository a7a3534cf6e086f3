package com.ztverify.riskauth.domain.risk;

/**
 * Half-open window of UTC hours {@code [start, end)}. A window whose end precedes its start wraps
 * past midnight, so {@code 22-3} covers 22, 23, 0, 1 and 2.
 */
public record HourWindow(int startInclusive, int endExclusive) {

    public HourWindow {
        if (startInclusive < 0 || startInclusive > 23 || endExclusive < 0 || endExclusive > 24) {
            throw new IllegalArgumentException("Invalid hour window " + startInclusive + "-" + endExclusive);
        }
    }

    public static HourWindow parse(String text) {
        String[] parts = text.trim().split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Hour window must look like 'start-end': " + text);
        }
        return new HourWindow(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
    }

    public boolean contains(int hour) {
        if (startInclusive <= endExclusive) {
            return hour >= startInclusive && hour < endExclusive;
        }
        return hour >= startInclusive || hour < endExclusive;
    }

    @Override
    public String toString() {
        return startInclusive + "-" + endExclusive;
    }
}
