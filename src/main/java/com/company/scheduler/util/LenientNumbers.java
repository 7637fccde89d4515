package com.company.scheduler.util;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the leading decimal number of a free-text value, so "92.5%" reads as 92.5.
 * Text without a leading number yields an empty result.
 */
public final class LenientNumbers {

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private LenientNumbers() {
    }

    public static OptionalDouble parse(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(text.trim());
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
