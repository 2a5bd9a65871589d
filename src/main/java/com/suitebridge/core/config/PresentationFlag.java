package com.suitebridge.core.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * Single-letter options accepted after {@code -o} and {@code -e}.
 */
public enum PresentationFlag {
    PRESENT_ALL_DURATIONS('D'),
    PRESENT_WITHOUT_COLOR('W'),
    PRESENT_SHORT_STACK_TRACES('S'),
    PRESENT_FULL_STACK_TRACES('F'),
    PRESENT_UNFORMATTED('U'),
    PRESENT_REMINDER_WITHOUT_STACK_TRACES('I'),
    PRESENT_REMINDER_WITH_SHORT_STACK_TRACES('T'),
    PRESENT_REMINDER_WITH_FULL_STACK_TRACES('G'),
    PRESENT_REMINDER_WITHOUT_CANCELED_TESTS('K'),
    FILTER_TEST_STARTING('N'),
    FILTER_TEST_SUCCEEDED('C'),
    FILTER_TEST_IGNORED('X'),
    FILTER_TEST_PENDING('E'),
    FILTER_SUITE_STARTING('H'),
    FILTER_SUITE_COMPLETED('L'),
    FILTER_INFO_PROVIDED('O');

    private final char letter;

    PresentationFlag(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public static Optional<PresentationFlag> fromLetter(char letter) {
        return Arrays.stream(values()).filter(f -> f.letter == letter).findFirst();
    }
}
