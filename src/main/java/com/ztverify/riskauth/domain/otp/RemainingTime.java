package com.ztverify.riskauth.domain.otp;

public final class RemainingTime {

    private RemainingTime() {
    }

    /** e.g. {@code 2 minutes 30 seconds}, {@code 1 minute}, {@code 45 seconds}, {@code 0 seconds}. */
    public static String format(long totalSeconds) {
        long seconds = Math.max(0L, totalSeconds);
        long minutes = seconds / 60;
        long rest = seconds % 60;
        if (minutes == 0) {
            return plural(rest, "second");
        }
        if (rest == 0) {
            return plural(minutes, "minute");
        }
        return plural(minutes, "minute") + " " + plural(rest, "second");
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }
}
