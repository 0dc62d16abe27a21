package dev.flowdoctor.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Forgiving JSON recovery for generator output.
 *
 * <p>Recovery runs in stages, stopping at the first that parses:
 * <ol>
 *   <li>strict parse</li>
 *   <li>strip wrapping quotes and CSV-doubled quotes</li>
 *   <li>lenient syntax: unquoted names, single quotes, trailing commas, comments</li>
 *   <li>textual repairs: bare {@code {VAR}} values, bare word values, surplus closing
 *       braces, missing closing brackets</li>
 * </ol>
 */
public final class LenientJson {

    private static final ObjectMapper STRICT = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private static final ObjectMapper LENIENT = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private static final Pattern BARE_VARIABLE = Pattern.compile(":(\\s*)\\{([A-Za-z_][A-Za-z0-9_]*)\\}");
    private static final Pattern BARE_WORD = Pattern.compile(":(\\s*)([A-Za-z][A-Za-z0-9 ]*?)(\\s*[,}\\]])");

    private LenientJson() {}

    /**
     * Strict parse only. Empty when the text is not a single valid JSON value.
     */
    public static Optional<JsonNode> parseStrict(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = STRICT.readTree(text.trim());
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Recover a JSON value from possibly malformed text.
     */
    public static JsonRecovery recover(String text) {
        if (text == null || text.isBlank()) {
            return new JsonRecovery.Unrecoverable("empty input", text == null ? "" : text);
        }
        var steps = new ArrayList<String>();
        String candidate = text.trim();

        Optional<JsonNode> strict = parseStrict(candidate);
        if (strict.isPresent()) {
            return parsed(strict.get(), steps);
        }

        String unquoted = stripQuoting(candidate);
        if (!unquoted.equals(candidate)) {
            Optional<JsonNode> unwrapped = parseStrict(unquoted).or(() -> parseLenient(unquoted));
            if (unwrapped.isPresent()) {
                steps.add("removed wrapping quotes");
                return parsed(unwrapped.get(), steps);
            }
        }

        Optional<JsonNode> lenient = parseLenient(candidate);
        if (lenient.isPresent()) {
            steps.add("normalized lenient syntax");
            return parsed(lenient.get(), steps);
        }

        String repaired = quoteBareVariables(candidate);
        if (!repaired.equals(candidate)) {
            steps.add("quoted bare variable references");
            candidate = repaired;
            lenient = parseLenient(candidate);
            if (lenient.isPresent()) {
                return parsed(lenient.get(), steps);
            }
        }

        repaired = quoteBareWords(candidate);
        if (!repaired.equals(candidate)) {
            steps.add("quoted bare string values");
            candidate = repaired;
            lenient = parseLenient(candidate);
            if (lenient.isPresent()) {
                return parsed(lenient.get(), steps);
            }
        }

        repaired = balanceBrackets(candidate);
        if (!repaired.equals(candidate)) {
            steps.add("balanced brackets");
            candidate = repaired;
            lenient = parseLenient(candidate);
            if (lenient.isPresent()) {
                return parsed(lenient.get(), steps);
            }
        }

        return new JsonRecovery.Unrecoverable("could not repair JSON", text);
    }

    /** Compact strict rendering of a tree. */
    public static String write(JsonNode node) {
        try {
            return STRICT.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON tree", e);
        }
    }

    public static ObjectMapper mapper() {
        return STRICT;
    }

    private static JsonRecovery parsed(JsonNode node, List<String> steps) {
        return new JsonRecovery.Parsed(node, write(node), steps);
    }

    private static Optional<JsonNode> parseLenient(String text) {
        try {
            JsonNode node = LENIENT.readTree(text);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * {@code "{...}"} or {@code '{...}'} wrapping, and {@code ""} CSV escaping left in place.
     */
    static String stripQuoting(String text) {
        String cleaned = text;
        if (cleaned.startsWith("\"\"") || cleaned.contains("{\"\"")) {
            cleaned = cleaned.replace("\"\"", "\"");
        }
        if (cleaned.length() >= 2
            && ((cleaned.startsWith("\"") && cleaned.endsWith("\""))
                || (cleaned.startsWith("'") && cleaned.endsWith("'")))) {
            String inner = cleaned.substring(1, cleaned.length() - 1).trim();
            if (inner.startsWith("{") || inner.startsWith("[")) {
                cleaned = inner;
            }
        }
        return cleaned;
    }

    static String quoteBareVariables(String text) {
        return BARE_VARIABLE.matcher(text).replaceAll(":$1\"{$2}\"");
    }

    static String quoteBareWords(String text) {
        Matcher matcher = BARE_WORD.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            String word = matcher.group(2).trim();
            String replacement = switch (word) {
                case "true", "false", "null" -> matcher.group();
                default -> ":" + matcher.group(1) + "\"" + word + "\"" + matcher.group(3);
            };
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Drop closing brackets that close nothing and append the ones still open,
     * ignoring bracket characters inside string literals.
     */
    static String balanceBrackets(String text) {
        var out = new StringBuilder(text.length() + 4);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(text.charAt(++i));
                } else if (c == quote) {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> {
                    inString = true;
                    quote = c;
                    out.append(c);
                }
                case '{', '[' -> {
                    open.push(c);
                    out.append(c);
                }
                case '}', ']' -> {
                    char expected = c == '}' ? '{' : '[';
                    if (!open.isEmpty() && open.peek() == expected) {
                        open.pop();
                        out.append(c);
                    }
                }
                default -> out.append(c);
            }
        }
        if (inString) {
            out.append(quote);
        }
        while (!open.isEmpty()) {
            out.append(open.pop() == '{' ? '}' : ']');
        }
        return out.toString();
    }
}
