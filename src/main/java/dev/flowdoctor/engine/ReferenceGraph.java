package dev.flowdoctor.engine;

import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.Reference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Directed multigraph of references between node ids.
 */
public final class ReferenceGraph {

    private final Set<Integer> ids;
    private final Map<Integer, List<Reference>> outgoing;

    private ReferenceGraph(Set<Integer> ids, Map<Integer, List<Reference>> outgoing) {
        this.ids = ids;
        this.outgoing = outgoing;
    }

    public static ReferenceGraph of(List<FlowNode> nodes) {
        var ids = new TreeSet<Integer>();
        var outgoing = new LinkedHashMap<Integer, List<Reference>>();
        for (FlowNode node : nodes) {
            ids.add(node.id());
            outgoing.computeIfAbsent(node.id(), k -> new ArrayList<>()).addAll(Reference.of(node));
        }
        return new ReferenceGraph(Collections.unmodifiableSet(ids), outgoing);
    }

    public Set<Integer> ids() {
        return ids;
    }

    public List<Reference> outgoing(int id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /** Distinct targets of a node, in order of first appearance. */
    public Set<Integer> targets(int id) {
        var targets = new LinkedHashSet<Integer>();
        outgoing(id).forEach(r -> targets.add(r.target()));
        return targets;
    }

    /** References whose target is not a node of the graph. */
    public List<Reference> orphans() {
        var orphans = new ArrayList<Reference>();
        outgoing.values().forEach(refs -> refs.stream()
            .filter(r -> !ids.contains(r.target()))
            .forEach(orphans::add));
        return orphans;
    }

    /** Ids reachable from a start node, the start included when it exists. */
    public Set<Integer> reachableFrom(int start) {
        var seen = new TreeSet<Integer>();
        if (!ids.contains(start)) {
            return seen;
        }
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            for (int target : targets(queue.poll())) {
                if (ids.contains(target) && seen.add(target)) {
                    queue.add(target);
                }
            }
        }
        return seen;
    }
}
