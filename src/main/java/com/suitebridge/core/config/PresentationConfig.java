package com.suitebridge.core.config;

import java.util.EnumSet;
import java.util.Set;

/**
 * Presentation settings of one reporter ({@code -o} for host logs, {@code -e} for stderr).
 */
public record PresentationConfig(Set<PresentationFlag> flags) {

    public PresentationConfig {
        flags = flags == null || flags.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(flags));
    }

    public static PresentationConfig defaults() {
        return new PresentationConfig(Set.of());
    }

    /**
     * Parses the letters following {@code -o} or {@code -e}.
     *
     * @throws ArgumentException on an unknown letter
     */
    public static PresentationConfig parse(String option, String letters) {
        EnumSet<PresentationFlag> parsed = EnumSet.noneOf(PresentationFlag.class);
        for (char letter : letters.toCharArray()) {
            PresentationFlag flag = PresentationFlag.fromLetter(letter)
                    .orElseThrow(() -> new ArgumentException(
                            "Unrecognized presentation flag '" + letter + "' in " + option + letters));
            parsed.add(flag);
        }
        return new PresentationConfig(parsed);
    }

    public boolean has(PresentationFlag flag) {
        return flags.contains(flag);
    }

    public boolean presentAllDurations() {
        return has(PresentationFlag.PRESENT_ALL_DURATIONS);
    }

    public boolean presentInColor() {
        return !has(PresentationFlag.PRESENT_WITHOUT_COLOR);
    }

    public boolean presentShortStackTraces() {
        return has(PresentationFlag.PRESENT_SHORT_STACK_TRACES) || presentFullStackTraces();
    }

    public boolean presentFullStackTraces() {
        return has(PresentationFlag.PRESENT_FULL_STACK_TRACES);
    }

    public boolean presentUnformatted() {
        return has(PresentationFlag.PRESENT_UNFORMATTED);
    }

    /** True when any of {@code I}, {@code T} or {@code G} is set. */
    public boolean presentReminder() {
        return has(PresentationFlag.PRESENT_REMINDER_WITHOUT_STACK_TRACES)
                || has(PresentationFlag.PRESENT_REMINDER_WITH_SHORT_STACK_TRACES)
                || has(PresentationFlag.PRESENT_REMINDER_WITH_FULL_STACK_TRACES);
    }

    public boolean presentReminderWithShortStackTraces() {
        return has(PresentationFlag.PRESENT_REMINDER_WITH_SHORT_STACK_TRACES);
    }

    public boolean presentReminderWithFullStackTraces() {
        return has(PresentationFlag.PRESENT_REMINDER_WITH_FULL_STACK_TRACES);
    }

    public boolean presentReminderWithoutCanceledTests() {
        return has(PresentationFlag.PRESENT_REMINDER_WITHOUT_CANCELED_TESTS);
    }
}
