package dev.flowdoctor.repair;

import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;

import java.util.List;

/**
 * Repaired nodes plus one log line per applied fix.
 */
public record RepairResult(List<FlowNode> records, List<String> fixLog) {

    public RepairResult {
        records = List.copyOf(records);
        fixLog = List.copyOf(fixLog);
    }

    public boolean changed() {
        return !fixLog.isEmpty();
    }

    /** The records as a document. Fails if ids still repeat. */
    public FlowDocument document() {
        return new FlowDocument(records);
    }
}
