package com.circuitsync.core.util;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for reference labels such as {@code R12} and pin numbers.
 */
public final class References {

    private static final Pattern PREFIX_ONLY = Pattern.compile("([A-Za-z_#]+)\\??");
    private static final Pattern NUMBERED = Pattern.compile("([A-Za-z_#]+)(\\d+)");

    /** Orders numeric strings by value and everything else lexicographically. */
    public static final Comparator<String> NATURAL_ORDER = (a, b) -> {
        boolean na = a.chars().allMatch(Character::isDigit) && !a.isEmpty();
        boolean nb = b.chars().allMatch(Character::isDigit) && !b.isEmpty();
        if (na && nb) {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        }
        return a.compareTo(b);
    };

    private References() {
        // Utility class
    }

    /**
     * @return true for references still to be numbered, e.g. {@code R} or {@code R?}
     */
    public static boolean isPrefixOnly(String reference) {
        return PREFIX_ONLY.matcher(reference).matches();
    }

    /**
     * Letter prefix of a reference: {@code R} for {@code R12}, {@code R?} and {@code R}.
     */
    public static String prefix(String reference) {
        Matcher numbered = NUMBERED.matcher(reference);
        if (numbered.matches()) {
            return numbered.group(1);
        }
        Matcher prefixOnly = PREFIX_ONLY.matcher(reference);
        if (prefixOnly.matches()) {
            return prefixOnly.group(1);
        }
        return reference;
    }

    /**
     * Number of a reference, or -1 when it has none.
     */
    public static int number(String reference) {
        Matcher numbered = NUMBERED.matcher(reference);
        if (numbered.matches()) {
            try {
                return Integer.parseInt(numbered.group(2));
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }
}
