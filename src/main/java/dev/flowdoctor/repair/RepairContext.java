package dev.flowdoctor.repair;

import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.model.CommandOutputContract;
import dev.flowdoctor.model.FlowNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Working copy of the nodes for one repair pass, plus the fix log.
 * Rules replace nodes here; the caller's list is never touched.
 */
public final class RepairContext {

    private final List<FlowNode> nodes;
    private final List<String> fixLog = new ArrayList<>();
    private final CommandOutputContract contract;
    private final NodeAllocator allocator;

    RepairContext(List<FlowNode> nodes, CommandOutputContract contract, NodeAllocator allocator) {
        this.nodes = new ArrayList<>(nodes);
        this.contract = contract;
        this.allocator = allocator;
    }

    public List<FlowNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public CommandOutputContract contract() { return contract; }
    public NodeAllocator allocator() { return allocator; }
    public List<String> fixLog() { return Collections.unmodifiableList(fixLog); }

    public SortedSet<Integer> ids() {
        var ids = new TreeSet<Integer>();
        nodes.forEach(n -> ids.add(n.id()));
        return ids;
    }

    public Optional<FlowNode> node(int id) {
        return nodes.stream().filter(n -> n.id() == id).findFirst();
    }

    public List<FlowNode> nodesWithId(int id) {
        return nodes.stream().filter(n -> n.id() == id).toList();
    }

    /**
     * Apply a change to every Decision with the id. Logs the description once when anything changed.
     */
    public boolean updateDecision(int id, UnaryOperator<FlowNode.Decision> change, String description) {
        return update(id, node -> node instanceof FlowNode.Decision d ? change.apply(d) : node, description);
    }

    public boolean updateAction(int id, UnaryOperator<FlowNode.Action> change, String description) {
        return update(id, node -> node instanceof FlowNode.Action a ? change.apply(a) : node, description);
    }

    public boolean update(int id, UnaryOperator<FlowNode> change, String description) {
        boolean changed = false;
        for (int i = 0; i < nodes.size(); i++) {
            FlowNode node = nodes.get(i);
            if (node.id() != id) {
                continue;
            }
            FlowNode updated = change.apply(node);
            if (!updated.equals(node)) {
                nodes.set(i, updated);
                changed = true;
            }
        }
        if (changed) {
            fix(id, description);
        }
        return changed;
    }

    public void add(FlowNode node) {
        nodes.add(node);
    }

    public void addFirst(FlowNode node) {
        nodes.add(0, node);
    }

    public void replaceAll(List<FlowNode> replacement) {
        nodes.clear();
        nodes.addAll(replacement);
    }

    /** Log a change to one node. */
    public void fix(int nodeId, String description) {
        fixLog.add("Node %d: %s".formatted(nodeId, description));
    }

    /** Log a document-level change. */
    public void note(String description) {
        fixLog.add(description);
    }
}
