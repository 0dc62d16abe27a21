package dev.flowdoctor.allocate;

import dev.flowdoctor.model.AllocationBands;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeMeta;
import dev.flowdoctor.model.Route;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeAllocatorTest {

    private final NodeAllocator allocator = NodeAllocator.withDefaultBands();

    @Test
    void leavesRecordsAloneWithoutCollisions() {
        var nodes = List.<FlowNode>of(FlowNode.Decision.of(10, "A", "a").withNextNodes(List.of(11)));

        RemapResult result = allocator.remap(nodes, 1, Set.of(20));

        assertThat(result.changed()).isFalse();
        assertThat(result.records()).isEqualTo(nodes);
    }

    @Test
    void movesCollidingIdsIntoFlowBandAndRewritesReferences() {
        var nodes = List.<FlowNode>of(
            FlowNode.Decision.of(10, "A", "a").withNextNodes(List.of(11)),
            FlowNode.Decision.of(11, "B", "b").withRich("button", "Again~10"));

        RemapResult result = allocator.remap(nodes, 1, Set.of(10));

        assertThat(result.idMapping()).containsExactly(Map.entry(10, 400));
        assertThat(result.records()).extracting(FlowNode::id).containsExactly(400, 11);
        assertThat(((FlowNode.Decision) result.records().get(1)).richContent()).isEqualTo("Again~400");
    }

    @Test
    void skipsIdsAlreadyTaken() {
        var nodes = List.<FlowNode>of(
            FlowNode.Decision.of(400, "Taken", "a").withNextNodes(List.of(10)),
            FlowNode.Decision.of(10, "Moves", "b").withNextNodes(List.of(400)));

        RemapResult result = allocator.remap(nodes, 1, Set.of(10));

        assertThat(result.idMapping()).containsExactly(Map.entry(10, 401));
        assertThat(((FlowNode.Decision) result.records().get(0)).nextNodes()).containsExactly(401);
    }

    @Test
    void rewritesNodeInputSources() {
        var nodes = List.<FlowNode>of(
            FlowNode.Decision.of(10, "Ask", "Name?").withAnswerRequired(true).withNextNodes(List.of(12)),
            new FlowNode.Action(12, "Save", NodeMeta.empty(), "SaveName", "", "", Map.of("NAME", 10), "",
                "success", List.of(new Route("true", 10), new Route("error", 99990))));

        RemapResult result = allocator.remap(nodes, 1, Set.of(10));

        var save = (FlowNode.Action) result.records().get(1);
        assertThat(save.nodeInput()).containsExactly(Map.entry("NAME", 400));
        assertThat(save.whatNext()).containsExactly(new Route("true", 400), new Route("error", 99990));
    }

    @Test
    void continuesInNextBandWhenFull() {
        var small = new NodeAllocator(new AllocationBands(1, 199, 200, 299, 300, 2));
        var nodes = List.<FlowNode>of(
            FlowNode.Decision.of(10, "A", "a"),
            FlowNode.Decision.of(11, "B", "b"),
            FlowNode.Decision.of(12, "C", "c"));

        RemapResult result = small.remap(nodes, 0, Set.of(10, 11, 12));

        assertThat(result.idMapping()).containsExactly(Map.entry(10, 300), Map.entry(11, 301), Map.entry(12, 302));
        assertThat(result.warnings()).containsExactly("flow 0 band 300-301 is full, continuing in band 302-303");
    }

    @Test
    void neverAllocatesReservedSystemIds() {
        var bands = new AllocationBands(1, 199, 200, 299, 1700, 100);
        var nodes = List.<FlowNode>of(FlowNode.Decision.of(10, "A", "a"));

        RemapResult result = new NodeAllocator(bands).remap(nodes, 1, Set.of(10));

        assertThat(result.idMapping()).containsExactly(Map.entry(10, 1805));
    }

    @Test
    void recheckRenumbersLaterDuplicates() {
        var nodes = List.<FlowNode>of(
            FlowNode.Decision.of(5, "A", "a"),
            FlowNode.Decision.of(5, "B", "b"),
            FlowNode.Decision.of(6, "C", "c"));

        RemapResult result = allocator.recheck(nodes);

        assertThat(result.records()).extracting(FlowNode::id).containsExactly(5, 7, 6);
        assertThat(result.idMapping()).isEmpty();
        assertThat(result.warnings()).containsExactly("duplicate node 5 (B) renumbered to 7");
    }

    @Test
    void bandsRejectInvalidLayouts() {
        assertThatThrownBy(() -> new AllocationBands(1, 199, 200, 299, 250, 100))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AllocationBands(1, 199, 200, 299, 300, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
