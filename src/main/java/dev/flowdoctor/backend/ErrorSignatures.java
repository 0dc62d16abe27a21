package dev.flowdoctor.backend;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Stable keys for validator errors, so the same problem is recognized across iterations even after
 * nodes were renumbered.
 */
public final class ErrorSignatures {

    public static final String NLU_DISABLED_MULTI_CHILD = "NLU_DISABLED_MULTI_CHILD";
    public static final String INVALID_JSON = "INVALID_JSON";
    public static final String MISSING_REFERENCE = "MISSING_REFERENCE";
    public static final String NEXT_NODES_CONSTRAINT = "NEXT_NODES_CONSTRAINT";
    public static final String RICH_ASSET_ERROR = "RICH_ASSET_ERROR";
    public static final String MESSAGE_LENGTH = "MESSAGE_LENGTH";
    public static final String RESERVED_CHARACTER = "RESERVED_CHARACTER";
    public static final String ANSWER_REQUIRED_CONSTRAINT = "ANSWER_REQUIRED_CONSTRAINT";
    public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

    private static final Pattern NODE_NUMBER = Pattern.compile("node \\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_NUMBER = Pattern.compile("\"\\d+\"");
    private static final Pattern ROW_NUMBER = Pattern.compile("row \\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHARACTER_COUNT = Pattern.compile("\\d+ characters?", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ErrorSignatures() {}

    /**
     * {@code field:description} in lower case with node numbers, quoted numbers, row numbers and
     * character counts masked.
     */
    public static String normalize(ExternalError error) {
        String description = error.message();
        description = NODE_NUMBER.matcher(description).replaceAll("node X");
        description = QUOTED_NUMBER.matcher(description).replaceAll("\"X\"");
        description = ROW_NUMBER.matcher(description).replaceAll("row X");
        description = CHARACTER_COUNT.matcher(description).replaceAll("N characters");
        String field = error.field().isBlank() ? "unknown" : error.field();
        return (field + ":" + description).toLowerCase(Locale.ROOT).trim();
    }

    public static String categorize(ExternalError error) {
        String description = error.message().toLowerCase(Locale.ROOT);
        String field = error.field().toLowerCase(Locale.ROOT);

        if (description.contains("nlu disabled") && description.contains("one child")) {
            return NLU_DISABLED_MULTI_CHILD;
        }
        if (description.contains("invalid json") || description.contains("malformed")) {
            return INVALID_JSON;
        }
        if (description.contains("does not exist") || description.contains("not found")) {
            return MISSING_REFERENCE;
        }
        if (field.contains("next nodes") && description.contains("child")) {
            return NEXT_NODES_CONSTRAINT;
        }
        if (field.contains("rich asset")) {
            return RICH_ASSET_ERROR;
        }
        if (field.contains("message") && description.contains("character")) {
            return MESSAGE_LENGTH;
        }
        if (description.contains("reserved") || description.contains("special character")) {
            return RESERVED_CHARACTER;
        }
        if (description.contains("answer required")) {
            return ANSWER_REQUIRED_CONSTRAINT;
        }
        if (field.isBlank()) {
            return UNKNOWN_ERROR;
        }
        return WHITESPACE.matcher(field.trim()).replaceAll("_").toUpperCase(Locale.ROOT) + "_ERROR";
    }
}
