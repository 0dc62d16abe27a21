package dev.flowdoctor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Node type as written in the Node Type column.
 */
public enum NodeKind {
    DECISION("D", "DECISION"),
    ACTION("A", "ACTION");

    private final String code;
    private final String longName;

    NodeKind(String code, String longName) {
        this.code = code;
        this.longName = longName;
    }

    public String code() { return code; }

    public static Optional<NodeKind> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (NodeKind kind : values()) {
            if (kind.code.equals(value) || kind.longName.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
