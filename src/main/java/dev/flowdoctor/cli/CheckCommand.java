package dev.flowdoctor.cli;

import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.engine.ReferenceGraph;
import dev.flowdoctor.engine.ValidationReport;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.ErrorCategory;
import dev.flowdoctor.model.FlowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "check", mixinStandardHelpOptions = true,
    description = "Report structural diagnostics for a flow document.")
class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Flow CSV file")
    private Path csv;

    @Option(names = "--contract", description = "Extra command output contracts, JSON {\"Command\": [\"value\", ...]}")
    private Path contractFile;

    @Override
    public Integer call() {
        ValidationReport report;
        try {
            report = FlowDoctorCli.validator(contractFile).validate(FlowCsvCodec.parse(FlowDoctorCli.read(csv)));
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return FlowDoctorCli.FAILURE;
        }
        report.diagnostics().forEach(System.out::println);

        Map<ErrorCategory, Integer> byCategory = new EnumMap<>(ErrorCategory.class);
        for (Diagnostic d : report.diagnostics()) {
            byCategory.merge(d.category(), 1, Integer::sum);
        }
        ReferenceGraph graph = ReferenceGraph.of(report.records());
        int unreachable = graph.ids().size() - graph.reachableFrom(FlowDocument.ENTRY_NODE).size();

        System.out.printf("%d node(s), %d malformed row(s), %d unreachable from node %d, %d diagnostic(s)%n",
            report.records().size(), report.malformed().size(), unreachable, FlowDocument.ENTRY_NODE,
            report.diagnostics().size());
        byCategory.forEach((category, count) -> System.out.printf("  %s: %d%n", category, count));
        return report.isClean() ? FlowDoctorCli.OK : FlowDoctorCli.REMAINING_ERRORS;
    }
}
