package com.dcruver.ideatree.domain;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Approximate equality between short idea strings.
 *
 * Two ideas match when their normalised forms are equal, or when one contains the other
 * and the shorter of the two has at least {@link #MIN_CONTAINMENT_LENGTH} characters.
 * When several candidates match, an exact match wins over containment, and otherwise
 * the earliest candidate in insertion order wins.
 */
public final class IdeaMatcher {

    public static final int MIN_CONTAINMENT_LENGTH = 3;

    private IdeaMatcher() {
    }

    /**
     * Lower-cased, trimmed, single-spaced form used for all comparisons.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup key for group and subgroup names.
     */
    public static String key(String name) {
        return normalize(name);
    }

    public static boolean sameName(String a, String b) {
        return key(a).equals(key(b));
    }

    /**
     * Equal after normalisation. Blank never matches.
     */
    public static boolean sameText(String a, String b) {
        String left = normalize(a);
        return !left.isEmpty() && left.equals(normalize(b));
    }

    public static boolean matches(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        if (left.equals(right)) {
            return true;
        }
        String shorter = left.length() <= right.length() ? left : right;
        String longer = shorter == left ? right : left;
        return shorter.length() >= MIN_CONTAINMENT_LENGTH && longer.contains(shorter);
    }

    /**
     * Index of the candidate that best matches the given idea, if any does.
     */
    public static OptionalInt bestMatch(List<String> candidates, String idea) {
        String target = normalize(idea);
        int firstContainment = -1;
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (normalize(candidate).equals(target) && !target.isEmpty()) {
                return OptionalInt.of(i);
            }
            if (firstContainment < 0 && matches(candidate, idea)) {
                firstContainment = i;
            }
        }
        return firstContainment < 0 ? OptionalInt.empty() : OptionalInt.of(firstContainment);
    }

    public static boolean containsMatch(List<String> candidates, String idea) {
        return bestMatch(candidates, idea).isPresent();
    }
}
