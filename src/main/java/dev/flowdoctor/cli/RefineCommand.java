package dev.flowdoctor.cli;

import dev.flowdoctor.allocate.FlowAssembler;
import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.backend.AuthenticationException;
import dev.flowdoctor.backend.Credentials;
import dev.flowdoctor.backend.ExternalServiceException;
import dev.flowdoctor.backend.HttpGenerativeRepairer;
import dev.flowdoctor.backend.HttpSemanticValidator;
import dev.flowdoctor.backend.InMemoryErrorLearningStore;
import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.config.Settings;
import dev.flowdoctor.model.RefinementSettings;
import dev.flowdoctor.refine.ParallelRefinement;
import dev.flowdoctor.refine.RefinementOrchestrator;
import dev.flowdoctor.refine.RefinementResult;
import dev.flowdoctor.refine.Sanitizer;
import dev.flowdoctor.repair.RepairEngine;
import org.springframework.web.client.RestTemplate;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "refine", mixinStandardHelpOptions = true,
    description = "Refine flow documents against the semantic validator and generative repairer.")
class RefineCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Flow CSV file; several files are refined in parallel and assembled")
    private List<Path> flows;

    @Option(names = {"-o", "--output"}, description = "Write the refined document here (default: stdout)")
    private Path output;

    @Option(names = "--validator-url", required = true, description = "Semantic validator endpoint")
    private String validatorUrl;

    @Option(names = "--repairer-url", required = true, description = "Generative repairer endpoint")
    private String repairerUrl;

    @Option(names = "--bot-id", required = true, description = "Bot id passed to the validator")
    private String botId;

    @Option(names = "--token", required = true, description = "Token passed to the validator")
    private String token;

    @Option(names = "--settings", description = "Settings JSON file")
    private Path settingsFile;

    @Option(names = "--contract", description = "Extra command output contracts, JSON {\"Command\": [\"value\", ...]}")
    private Path contractFile;

    @Option(names = "--max-iterations", description = "Override the maximum number of iterations")
    private Integer maxIterations;

    @Override
    public Integer call() {
        try {
            Settings settings = FlowDoctorCli.settings(settingsFile);
            RefinementSettings refinement = maxIterations == null
                ? settings.refinement() : settings.refinement().withMaxIterations(maxIterations);
            var credentials = new Credentials(botId, token);
            var restTemplate = new RestTemplate();
            var allocator = new NodeAllocator(settings.bands());
            var validator = FlowDoctorCli.validator(contractFile);
            var sanitizer = new Sanitizer(validator, new RepairEngine(validator.contract(), allocator),
                allocator, refinement.sanitizePasses());
            var orchestrator = new RefinementOrchestrator(
                new HttpSemanticValidator(restTemplate, validatorUrl),
                new HttpGenerativeRepairer(restTemplate, repairerUrl),
                new InMemoryErrorLearningStore(), refinement, sanitizer);

            String refined;
            boolean accepted;
            if (flows.size() == 1) {
                RefinementResult result = orchestrator.refine(flows.get(0).getFileName().toString(),
                    FlowDoctorCli.read(flows.get(0)), credentials);
                report(flows.get(0).toString(), result);
                refined = result.csv();
                accepted = result.isAccepted();
            } else {
                var inputs = new ArrayList<ParallelRefinement.FlowInput>();
                for (int i = 0; i < flows.size(); i++) {
                    inputs.add(new ParallelRefinement.FlowInput(i, FlowDoctorCli.read(flows.get(i))));
                }
                ParallelRefinement.Outcome outcome = new ParallelRefinement(orchestrator, validator,
                    new FlowAssembler(allocator)).refineAll(inputs, credentials);
                outcome.results().forEach((index, result) -> report(flows.get(index).toString(), result));
                outcome.assembly().warnings().forEach(w -> System.err.println("note: " + w));
                refined = FlowCsvCodec.write(outcome.assembly().document());
                accepted = outcome.allAccepted();
            }

            if (output == null) {
                System.out.print(refined);
            } else {
                FlowDoctorCli.write(output, refined);
                System.err.println("Wrote " + output);
            }
            return accepted ? FlowDoctorCli.OK : FlowDoctorCli.REMAINING_ERRORS;
        } catch (AuthenticationException e) {
            System.err.println("Authentication failed: " + e.getMessage());
            return FlowDoctorCli.FAILURE;
        } catch (ExternalServiceException e) {
            System.err.println("Error: " + e.service() + " failed: " + e.getMessage());
            return FlowDoctorCli.FAILURE;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return FlowDoctorCli.FAILURE;
        }
    }

    private static void report(String name, RefinementResult result) {
        System.err.printf("%s: %s after %d iteration(s), %d fix(es)%n",
            name, result.status(), result.iterations(), result.fixesMade().size());
        if (result.versionId() != null) {
            System.err.println("  version: " + result.versionId());
        }
        result.remainingErrors().forEach(e -> System.err.println("  remaining: " + e.describe()));
    }
}
