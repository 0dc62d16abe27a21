package dev.flowdoctor.cli;

import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.config.Settings;
import dev.flowdoctor.refine.Sanitizer;
import dev.flowdoctor.repair.RepairEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "repair", mixinStandardHelpOptions = true,
    description = "Apply deterministic repairs and print the fix log.")
class RepairCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Flow CSV file")
    private Path csv;

    @Option(names = {"-o", "--output"}, description = "Write the repaired document here (default: stdout)")
    private Path output;

    @Option(names = "--settings", description = "Settings JSON file")
    private Path settingsFile;

    @Option(names = "--contract", description = "Extra command output contracts, JSON {\"Command\": [\"value\", ...]}")
    private Path contractFile;

    @Override
    public Integer call() {
        try {
            Settings settings = FlowDoctorCli.settings(settingsFile);
            var allocator = new NodeAllocator(settings.bands());
            var validator = FlowDoctorCli.validator(contractFile);
            var sanitizer = new Sanitizer(validator, new RepairEngine(validator.contract(), allocator),
                allocator, settings.refinement().sanitizePasses());

            Sanitizer.Sanitized result = sanitizer.sanitize(FlowDoctorCli.read(csv));
            result.fixLog().forEach(fix -> System.err.println("fixed: " + fix));
            result.residual().diagnostics().forEach(d -> System.err.println("remaining: " + d));

            if (output == null) {
                System.out.print(result.csv());
            } else {
                FlowDoctorCli.write(output, result.csv());
                System.err.println("Wrote " + output);
            }
            return result.residual().isClean() ? FlowDoctorCli.OK : FlowDoctorCli.REMAINING_ERRORS;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return FlowDoctorCli.FAILURE;
        }
    }
}
