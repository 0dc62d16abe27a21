package dev.flowdoctor.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonical form of plain-pipe button text ({@code label~dest|label~dest}).
 */
public final class ButtonText {

    private static final Pattern MISSING_SEPARATOR = Pattern.compile("(~-?\\d+)\\s*([A-Za-z<])");
    private static final Pattern UNIT_SUFFIX = Pattern.compile("^[kKmMbB](?![A-Za-z]).*", Pattern.DOTALL);
    private static final Pattern REPEATED_SEPARATOR = Pattern.compile("\\|{2,}");

    private ButtonText() {}

    /**
     * Rejoin labels split by a stray pipe ({@code $25|k~10} becomes {@code $25k~10}), insert missing
     * separators ({@code Yes~10No~20} becomes {@code Yes~10|No~20}) and collapse repeated pipes.
     * JSON and text without {@code ~} are returned unchanged.
     */
    public static String normalize(String content) {
        if (content == null) {
            return "";
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("{") || trimmed.startsWith("[") || !trimmed.contains("~")) {
            return content;
        }
        String fixed = joinSplitLabels(trimmed);
        fixed = MISSING_SEPARATOR.matcher(fixed).replaceAll("$1|$2");
        fixed = REPEATED_SEPARATOR.matcher(fixed).replaceAll("|");
        if (fixed.startsWith("|")) {
            fixed = fixed.substring(1);
        }
        if (fixed.endsWith("|")) {
            fixed = fixed.substring(0, fixed.length() - 1);
        }
        return fixed;
    }

    /** Describe what {@link #normalize} would change, for diagnostics. */
    public static List<String> defects(String content) {
        var defects = new ArrayList<String>();
        if (content == null || content.isBlank()) {
            return defects;
        }
        String trimmed = content.trim();
        if (!joinSplitLabels(trimmed).equals(trimmed)) {
            defects.add("pipe inside label");
        }
        if (MISSING_SEPARATOR.matcher(trimmed).find() && !trimmed.startsWith("{")) {
            defects.add("missing | between buttons");
        }
        if (REPEATED_SEPARATOR.matcher(trimmed).find() || trimmed.startsWith("|") || trimmed.endsWith("|")) {
            defects.add("empty button segment");
        }
        return defects;
    }

    private static String joinSplitLabels(String text) {
        String[] segments = text.split("\\|", -1);
        var out = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            out.append(segment);
            if (i == segments.length - 1) {
                break;
            }
            boolean splitLabel = !segment.contains("~")
                && !segment.isEmpty()
                && Character.isDigit(segment.charAt(segment.length() - 1))
                && UNIT_SUFFIX.matcher(segments[i + 1]).matches();
            if (!splitLabel) {
                out.append('|');
            }
        }
        return out.toString();
    }
}
