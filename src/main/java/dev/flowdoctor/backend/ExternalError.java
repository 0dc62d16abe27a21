package dev.flowdoctor.backend;

/**
 * One error reported by the semantic validator.
 *
 * @param nodeId     node the error is about, or null when the validator did not say
 * @param field      column name as the validator wrote it
 * @param message    error description
 * @param fieldEntry offending cell content, empty when not reported
 */
public record ExternalError(Integer nodeId, String field, String message, String fieldEntry) {

    public ExternalError {
        field = field == null ? "" : field;
        message = message == null ? "" : message;
        fieldEntry = fieldEntry == null ? "" : fieldEntry;
    }

    public static ExternalError of(Integer nodeId, String field, String message) {
        return new ExternalError(nodeId, field, message, "");
    }

    /** One-line form used in logs and result listings. */
    public String describe() {
        String node = nodeId == null ? "?" : nodeId.toString();
        return "Node %s [%s]: %s".formatted(node, field, message);
    }
}
