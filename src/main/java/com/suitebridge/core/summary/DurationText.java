package com.suitebridge.core.summary;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable elapsed time, e.g. {@code "1 second, 234 milliseconds"}.
 * <p>
 * Below a second only milliseconds are shown; below a minute seconds and milliseconds;
 * from a minute on the milliseconds are dropped. Zero components after the leading one
 * are omitted.
 */
public final class DurationText {

    private DurationText() {}

    public static String format(long millis) {
        if (millis < 0) {
            millis = 0;
        }
        long hours = millis / 3_600_000;
        long minutes = (millis / 60_000) % 60;
        long seconds = (millis / 1000) % 60;
        long ms = millis % 1000;

        if (millis < 1000) {
            return unit(ms, "millisecond");
        }
        List<String> parts = new ArrayList<>();
        if (millis < 60_000) {
            parts.add(unit(seconds, "second"));
            if (ms > 0) {
                parts.add(unit(ms, "millisecond"));
            }
        } else if (millis < 3_600_000) {
            parts.add(unit(minutes, "minute"));
            if (seconds > 0) {
                parts.add(unit(seconds, "second"));
            }
        } else {
            parts.add(unit(hours, "hour"));
            if (minutes > 0) {
                parts.add(unit(minutes, "minute"));
            }
            if (seconds > 0) {
                parts.add(unit(seconds, "second"));
            }
        }
        return String.join(", ", parts);
    }

    private static String unit(long value, String name) {
        return value + " " + name + (value == 1 ? "" : "s");
    }
}
