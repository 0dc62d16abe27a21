package dev.flowdoctor.allocate;

import dev.flowdoctor.model.AllocationBands;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.References;
import dev.flowdoctor.model.SystemNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps node ids inside their bands and renumbers on collision.
 */
public final class NodeAllocator {

    private static final Logger log = LoggerFactory.getLogger(NodeAllocator.class);

    private final AllocationBands bands;

    public NodeAllocator(AllocationBands bands) {
        this.bands = bands;
    }

    public static NodeAllocator withDefaultBands() {
        return new NodeAllocator(AllocationBands.defaults());
    }

    public AllocationBands bands() {
        return bands;
    }

    /**
     * Move every record whose id is in {@code reservedIds} to the next free id of the flow's band,
     * then rewrite all references to the moved ids. On band overflow allocation continues in the
     * next band and a warning is recorded. No two source ids map to the same target.
     */
    public RemapResult remap(List<FlowNode> records, int flowIndex, Set<Integer> reservedIds) {
        var warnings = new ArrayList<String>();
        Set<Integer> taken = new HashSet<>(reservedIds);
        taken.addAll(SystemNodes.RESERVED_IDS);
        records.forEach(n -> taken.add(n.id()));

        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        int band = flowIndex;
        int cursor = bands.bandStart(band);
        for (FlowNode node : records) {
            int id = node.id();
            if (!reservedIds.contains(id) || mapping.containsKey(id)) {
                continue;
            }
            while (taken.contains(cursor) || cursor > bands.bandEnd(band)) {
                if (cursor > bands.bandEnd(band)) {
                    warnings.add("flow %d band %d-%d is full, continuing in band %d-%d".formatted(
                        flowIndex, bands.bandStart(band), bands.bandEnd(band),
                        bands.bandStart(band + 1), bands.bandEnd(band + 1)));
                    band++;
                    cursor = bands.bandStart(band);
                    continue;
                }
                cursor++;
            }
            mapping.put(id, cursor);
            taken.add(cursor);
            log.debug("Flow {}: node {} collides with a reserved id, moved to {}", flowIndex, id, cursor);
        }

        if (mapping.isEmpty()) {
            return new RemapResult(records, mapping, warnings);
        }
        var remapped = new ArrayList<FlowNode>(records.size());
        for (FlowNode node : records) {
            FlowNode moved = node.withId(mapping.getOrDefault(node.id(), node.id()));
            moved = References.retarget(moved, target -> mapping.getOrDefault(target, target));
            moved = References.retargetInputs(moved, source -> mapping.getOrDefault(source, source));
            remapped.add(moved);
        }
        return new RemapResult(remapped, mapping, warnings);
    }

    /**
     * Resolve duplicate ids inside one document. The first occurrence keeps its id; later
     * occurrences move to the next free id above it. References are left alone, so they keep
     * pointing at the first occurrence. The mapping is empty because no reference moves.
     */
    public RemapResult recheck(List<FlowNode> records) {
        var warnings = new ArrayList<String>();
        Set<Integer> used = new HashSet<>();
        records.forEach(n -> used.add(n.id()));
        used.addAll(SystemNodes.RESERVED_IDS);

        Set<Integer> seen = new HashSet<>();
        var result = new ArrayList<FlowNode>(records.size());
        for (FlowNode node : records) {
            if (seen.add(node.id())) {
                result.add(node);
                continue;
            }
            int candidate = node.id() + 1;
            while (used.contains(candidate)) {
                candidate++;
            }
            used.add(candidate);
            seen.add(candidate);
            warnings.add("duplicate node %d (%s) renumbered to %d".formatted(node.id(), node.name(), candidate));
            result.add(node.withId(candidate));
        }
        return new RemapResult(result, Map.of(), warnings);
    }
}
