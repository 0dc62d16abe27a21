package dev.flowdoctor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The full, ordered set of nodes of one conversational script. Node ids are unique.
 */
public record FlowDocument(List<FlowNode> nodes) {

    public static final int ENTRY_NODE = 1;

    public FlowDocument {
        nodes = List.copyOf(nodes);
        var seen = new TreeSet<Integer>();
        for (FlowNode node : nodes) {
            if (!seen.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id in flow document: " + node.id());
            }
        }
    }

    public static FlowDocument of(FlowNode... nodes) {
        return new FlowDocument(List.of(nodes));
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(int id) {
        return nodes.stream().anyMatch(n -> n.id() == id);
    }

    public Optional<FlowNode> node(int id) {
        return nodes.stream().filter(n -> n.id() == id).findFirst();
    }

    public SortedSet<Integer> ids() {
        var ids = new TreeSet<Integer>();
        nodes.forEach(n -> ids.add(n.id()));
        return Collections.unmodifiableSortedSet(ids);
    }

    public List<Reference> references() {
        var refs = new ArrayList<Reference>();
        nodes.forEach(n -> refs.addAll(Reference.of(n)));
        return refs;
    }

    /** Nodes keyed by id, in ascending id order. */
    public Map<Integer, FlowNode> byId() {
        var map = new LinkedHashMap<Integer, FlowNode>();
        nodes.stream()
            .sorted((a, b) -> Integer.compare(a.id(), b.id()))
            .forEach(n -> map.put(n.id(), n));
        return map;
    }

    /** A copy with the node of the same id replaced, or appended when absent. */
    public FlowDocument with(FlowNode node) {
        var copy = new ArrayList<>(nodes);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).id() == node.id()) {
                copy.set(i, node);
                return new FlowDocument(copy);
            }
        }
        copy.add(node);
        return new FlowDocument(copy);
    }
}
