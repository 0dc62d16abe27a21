package dev.flowdoctor.allocate;

import dev.flowdoctor.model.FlowNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of renumbering a batch of nodes.
 *
 * @param records   the nodes with new ids and rewritten references
 * @param idMapping source id to new id, for every id that moved
 * @param warnings  band overflows and other notes worth surfacing
 */
public record RemapResult(List<FlowNode> records, Map<Integer, Integer> idMapping, List<String> warnings) {

    public RemapResult {
        records = List.copyOf(records);
        idMapping = Collections.unmodifiableMap(new LinkedHashMap<>(idMapping));
        warnings = List.copyOf(warnings);
    }

    public boolean changed() {
        return !idMapping.isEmpty() || !warnings.isEmpty();
    }
}
