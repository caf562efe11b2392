package com.graphol.index.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Sequential id generator for diagram items, one counter per id prefix.
 *
 * Owned by a project rather than shared globally, so two projects never
 * influence each other's ids.
 */
public class IdGenerator {

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern ITEM_ID = Pattern.compile("^(?<prefix>[^\\d]+)(?<value>\\d+)$");
    private static final Pattern LEADING_ZEROS = Pattern.compile("^0+(?=\\d)");
    private static final int MAX_DIGITS = 10;

    private final Map<String, Integer> ids = new LinkedHashMap<>();

    /**
     * Returns the next id for the given prefix, starting at prefix + "0".
     *
     * @throws IllegalArgumentException if the prefix is blank or contains a digit
     */
    public String next(String prefix) {
        if (prefix == null || prefix.isBlank() || DIGIT.matcher(prefix).find()) {
            throw new IllegalArgumentException(
                    "Invalid prefix supplied (" + prefix + "): id prefix must not be blank or contain any digit");
        }
        int value = ids.merge(prefix, 0, (last, ignored) -> last + 1);
        return prefix + value;
    }

    /**
     * Splits an id such as "n12" into its prefix and numeric value.
     *
     * @throws IllegalArgumentException if the id does not match prefix + digits
     *                                  or its value does not fit a counter
     */
    public static ParsedId parse(String id) {
        return tryParse(id).orElseThrow(() -> new IllegalArgumentException("Invalid id supplied (" + id + ")"));
    }

    /**
     * Lenient variant of {@link #parse(String)}: empty when the id is not a
     * generator id or its value leaves no room for a next id.
     */
    public static Optional<ParsedId> tryParse(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Matcher matcher = ITEM_ID.matcher(id);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String digits = LEADING_ZEROS.matcher(matcher.group("value")).replaceFirst("");
        if (digits.length() > MAX_DIGITS || Long.parseLong(digits) >= Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new ParsedId(matcher.group("prefix"), Integer.parseInt(digits)));
    }

    /**
     * Raises the counter of the id's prefix so that {@link #next(String)} never returns it again.
     */
    public void update(String id) {
        ParsedId parsed = parse(id);
        ids.merge(parsed.getPrefix(), parsed.getValue(), Math::max);
    }

    /**
     * Like {@link #update(String)} but ignores ids that a generator could not have produced.
     *
     * @return true if the id was recognised
     */
    public boolean tryUpdate(String id) {
        Optional<ParsedId> parsed = tryParse(id);
        parsed.ifPresent(p -> ids.merge(p.getPrefix(), p.getValue(), Math::max));
        return parsed.isPresent();
    }

    @Override
    public String toString() {
        return ids.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(",", "IdGenerator<", ">"));
    }

    /**
     * An id split into prefix and incremental value.
     */
    @Value
    public static class ParsedId {
        String prefix;
        int value;
    }
}
