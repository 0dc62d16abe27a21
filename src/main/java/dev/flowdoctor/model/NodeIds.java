package dev.flowdoctor.model;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Parsing rules for node identifiers.
 */
public final class NodeIds {

    private static final Pattern BARE_INTEGER = Pattern.compile("-?\\d{1,6}");

    /** No valid node number is longer than {@code -99999}. */
    public static final int MAX_ID_LENGTH = 6;

    private NodeIds() {}

    /**
     * Parse a trimmed cell as a node id. Only bare integers qualify:
     * {@code "1abc"}, {@code "1. Tap here"} and {@code "•"} are rejected.
     */
    public static OptionalInt parse(String raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        String value = raw.trim();
        if (value.length() > MAX_ID_LENGTH || !BARE_INTEGER.matcher(value).matches()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(value));
    }

    public static boolean isBareInteger(String raw) {
        return parse(raw).isPresent();
    }
}
