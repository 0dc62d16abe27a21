package dev.flowdoctor.allocate;

import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.SystemNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Joins independently generated flow segments into one document.
 *
 * <p>Segments are processed one at a time in flow-index order, whatever order they finished
 * in, so id collisions always resolve the same way. A system node already contributed by an
 * earlier segment is dropped from later ones rather than renumbered.
 */
public final class FlowAssembler {

    private static final Logger log = LoggerFactory.getLogger(FlowAssembler.class);

    private final NodeAllocator allocator;

    public FlowAssembler(NodeAllocator allocator) {
        this.allocator = allocator;
    }

    /** One generated flow and its position in the final document. */
    public record Segment(int flowIndex, List<FlowNode> nodes) {
        public Segment {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * @param document the assembled document
     * @param mappings per flow index, the ids that moved
     * @param warnings everything renumbered or dropped along the way
     */
    public record Assembly(FlowDocument document, Map<Integer, Map<Integer, Integer>> mappings, List<String> warnings) {
        public Assembly {
            mappings = Map.copyOf(mappings);
            warnings = List.copyOf(warnings);
        }
    }

    public Assembly assemble(List<Segment> segments) {
        List<Segment> ordered = segments.stream()
            .sorted(Comparator.comparingInt(Segment::flowIndex))
            .toList();

        var used = new TreeSet<Integer>();
        var nodes = new ArrayList<FlowNode>();
        var mappings = new LinkedHashMap<Integer, Map<Integer, Integer>>();
        var warnings = new ArrayList<String>();

        for (Segment segment : ordered) {
            var kept = new ArrayList<FlowNode>();
            for (FlowNode node : segment.nodes()) {
                if (SystemNodes.isReserved(node.id()) && used.contains(node.id())) {
                    warnings.add("flow %d: dropped duplicate system node %d".formatted(segment.flowIndex(), node.id()));
                    continue;
                }
                kept.add(node);
            }
            RemapResult remapped = allocator.remap(kept, segment.flowIndex(), used);
            mappings.put(segment.flowIndex(), remapped.idMapping());
            warnings.addAll(remapped.warnings());
            remapped.idMapping().forEach((from, to) ->
                warnings.add("flow %d: node %d renumbered to %d".formatted(segment.flowIndex(), from, to)));
            nodes.addAll(remapped.records());
            remapped.records().forEach(n -> used.add(n.id()));
        }

        RemapResult rechecked = allocator.recheck(nodes);
        warnings.addAll(rechecked.warnings());
        log.info("Assembled {} segments into {} nodes ({} warnings)", ordered.size(), nodes.size(), warnings.size());
        return new Assembly(new FlowDocument(rechecked.records()), mappings, warnings);
    }
}
