package dev.flowdoctor.refine;

import dev.flowdoctor.allocate.FlowAssembler;
import dev.flowdoctor.backend.Credentials;
import dev.flowdoctor.backend.ExternalServiceException;
import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.engine.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Refines independent flow segments concurrently, then assembles them in flow-index order.
 */
public final class ParallelRefinement {

    private static final Logger log = LoggerFactory.getLogger(ParallelRefinement.class);

    private final RefinementOrchestrator orchestrator;
    private final StructuralValidator validator;
    private final FlowAssembler assembler;
    private final int concurrency;

    public ParallelRefinement(RefinementOrchestrator orchestrator, StructuralValidator validator,
                              FlowAssembler assembler) {
        this.orchestrator = orchestrator;
        this.validator = validator;
        this.assembler = assembler;
        this.concurrency = orchestrator.settings().concurrency();
    }

    /** One flow segment to refine. */
    public record FlowInput(int flowIndex, String csv) {}

    /**
     * @param results  per flow index, the session result
     * @param assembly the refined segments assembled into one document
     */
    public record Outcome(Map<Integer, RefinementResult> results, FlowAssembler.Assembly assembly) {
        public Outcome {
            results = Map.copyOf(results);
        }

        public boolean allAccepted() {
            return results.values().stream().allMatch(RefinementResult::isAccepted);
        }
    }

    /**
     * @throws IllegalArgumentException when two inputs share a flow index
     * @throws ExternalServiceException when any session hits a fatal validator failure
     */
    public Outcome refineAll(List<FlowInput> flows, Credentials credentials) {
        ExecutorService pool = Executors.newFixedThreadPool(concurrency);
        try {
            var futures = new TreeMap<Integer, CompletableFuture<RefinementResult>>();
            for (FlowInput flow : flows) {
                if (futures.containsKey(flow.flowIndex())) {
                    throw new IllegalArgumentException("Duplicate flow index " + flow.flowIndex());
                }
                futures.put(flow.flowIndex(),
                    orchestrator.refineAsync("flow " + flow.flowIndex(), flow.csv(), credentials, pool));
            }
            log.info("Refining {} flow(s) with concurrency {}", flows.size(), concurrency);

            var results = new TreeMap<Integer, RefinementResult>();
            var segments = new ArrayList<FlowAssembler.Segment>();
            for (Map.Entry<Integer, CompletableFuture<RefinementResult>> entry : futures.entrySet()) {
                RefinementResult result = join(entry.getValue());
                results.put(entry.getKey(), result);
                segments.add(new FlowAssembler.Segment(entry.getKey(),
                    validator.validate(FlowCsvCodec.parse(result.csv())).records()));
            }
            FlowAssembler.Assembly assembly = assembler.assemble(segments);
            log.info("Assembled {} flow(s) into {} node(s)", segments.size(), assembly.document().nodes().size());
            return new Outcome(results, assembly);
        } finally {
            pool.shutdownNow();
        }
    }

    private static RefinementResult join(CompletableFuture<RefinementResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
