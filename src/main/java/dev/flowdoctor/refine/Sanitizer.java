package dev.flowdoctor.refine;

import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.allocate.RemapResult;
import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.engine.StructuralValidator;
import dev.flowdoctor.engine.ValidationReport;
import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.repair.RepairEngine;
import dev.flowdoctor.repair.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The deterministic stage run before every external call: validate, repair until the nodes stop
 * changing (bounded by the configured pass count), then re-check ids with the allocator.
 */
public final class Sanitizer {

    private static final Logger log = LoggerFactory.getLogger(Sanitizer.class);

    private final StructuralValidator validator;
    private final RepairEngine engine;
    private final NodeAllocator allocator;
    private final int passes;

    public Sanitizer(StructuralValidator validator, RepairEngine engine, NodeAllocator allocator, int passes) {
        if (passes < 1) {
            throw new IllegalArgumentException("passes must be at least 1, got " + passes);
        }
        this.validator = validator;
        this.engine = engine;
        this.allocator = allocator;
        this.passes = passes;
    }

    /**
     * @param csv      sanitized document text
     * @param fixLog   every fix applied, in order
     * @param residual diagnostics left after the last pass
     */
    public record Sanitized(String csv, List<String> fixLog, ValidationReport residual) {
        public Sanitized {
            fixLog = List.copyOf(fixLog);
        }

        public boolean changed() {
            return !fixLog.isEmpty();
        }
    }

    public Sanitized sanitize(String csv) {
        ValidationReport report = validator.validate(FlowCsvCodec.parse(csv));
        var fixLog = new ArrayList<String>();
        List<FlowNode> records = report.records();

        int pass = 0;
        while (pass < passes && !report.isClean()) {
            pass++;
            RepairResult result = engine.repair(report);
            fixLog.addAll(result.fixLog());
            boolean changed = !result.records().equals(records);
            records = result.records();
            report = validator.validateNodes(records);
            if (!changed) {
                break;
            }
        }

        RemapResult rechecked = allocator.recheck(records);
        if (rechecked.changed()) {
            records = rechecked.records();
            fixLog.addAll(rechecked.warnings());
            report = validator.validateNodes(records);
        }

        log.debug("Sanitized in {} pass(es): {} fix(es), {} diagnostic(s) left",
            pass, fixLog.size(), report.diagnostics().size());
        return new Sanitized(FlowCsvCodec.write(new FlowDocument(records)), fixLog, report);
    }
}
