package dev.flowdoctor.model;

/**
 * Every problem the structural validator can report. Each kind has exactly one repair rule.
 */
public enum DiagnosticKind {
    COLUMN_COUNT(ErrorCategory.MALFORMED_INPUT),
    NON_INTEGER_ID(ErrorCategory.MALFORMED_INPUT),
    UNKNOWN_NODE_TYPE(ErrorCategory.MALFORMED_INPUT),
    INVALID_FLAG(ErrorCategory.MALFORMED_INPUT),
    NON_INTEGER_REFERENCE(ErrorCategory.MALFORMED_INPUT),
    CROSS_KIND_FIELD(ErrorCategory.STRUCTURAL_VIOLATION),
    DUPLICATE_ID(ErrorCategory.STRUCTURAL_VIOLATION),
    MISSING_ENTRY_NODE(ErrorCategory.STRUCTURAL_VIOLATION),
    MISSING_SYSTEM_NODE(ErrorCategory.STRUCTURAL_VIOLATION),
    RICH_TYPE_MISMATCH(ErrorCategory.STRUCTURAL_VIOLATION),
    MALFORMED_RICH_JSON(ErrorCategory.STRUCTURAL_VIOLATION),
    ROOT_LEVEL_DEST(ErrorCategory.STRUCTURAL_VIOLATION),
    DEST_TYPE(ErrorCategory.STRUCTURAL_VIOLATION),
    PIPE_FORMAT(ErrorCategory.STRUCTURAL_VIOLATION),
    PICKER_CONSTRAINT(ErrorCategory.STRUCTURAL_VIOLATION),
    FILE_UPLOAD_PROPERTIES(ErrorCategory.STRUCTURAL_VIOLATION),
    DYNAMIC_EMBED(ErrorCategory.STRUCTURAL_VIOLATION),
    TRANSFER_WITH_NEXT_NODES(ErrorCategory.STRUCTURAL_VIOLATION),
    EMPTY_COMMAND(ErrorCategory.STRUCTURAL_VIOLATION),
    MISSING_DECISION_VARIABLE(ErrorCategory.STRUCTURAL_VIOLATION),
    MALFORMED_PARAM_INPUT(ErrorCategory.STRUCTURAL_VIOLATION),
    ROUTING_GAP(ErrorCategory.STRUCTURAL_VIOLATION),
    MISSING_ERROR_PATH(ErrorCategory.STRUCTURAL_VIOLATION),
    NLU_MULTI_DESTINATION(ErrorCategory.STRUCTURAL_VIOLATION),
    DEAD_END(ErrorCategory.STRUCTURAL_VIOLATION),
    ORPHAN_REFERENCE(ErrorCategory.STRUCTURAL_VIOLATION),
    VARIABLE_CASE(ErrorCategory.STRUCTURAL_VIOLATION),
    UNDECLARED_ASSIGNED_VARIABLE(ErrorCategory.STRUCTURAL_VIOLATION),
    UNBOUND_VARIABLE(ErrorCategory.STRUCTURAL_VIOLATION);

    private final ErrorCategory category;

    DiagnosticKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() { return category; }
}
