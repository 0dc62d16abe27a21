package dev.flowdoctor.repair;

import dev.flowdoctor.FlowFixtures;
import dev.flowdoctor.engine.StructuralValidator;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeMeta;
import dev.flowdoctor.model.Route;
import dev.flowdoctor.model.SystemNodes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RepairEngineTest {

    private final StructuralValidator validator = StructuralValidator.withBuiltInContract();
    private final RepairEngine engine = RepairEngine.withDefaults();

    @Test
    void hasExactlyOneRulePerKindInApplicationOrder() {
        assertThat(engine.rules()).extracting(RepairRule::kind)
            .containsExactlyElementsOf(RepairEngine.APPLICATION_ORDER)
            .containsExactlyInAnyOrder(DiagnosticKind.values());
    }

    @Test
    void cleanFlowIsLeftAlone() {
        List<FlowNode> nodes = FlowFixtures.cleanFlow();

        RepairResult result = repair(nodes);

        assertThat(result.changed()).isFalse();
        assertThat(result.records()).isEqualTo(nodes);
    }

    @Test
    void orphanButtonPointsAtReturnToMenu() {
        var target = FlowNode.Decision.of(10, "Target", "Here").withNextNodes(List.of(SystemNodes.MAIN_MENU));
        var back = FlowNode.Decision.of(SystemNodes.RETURN_TO_MENU, "Back", "Returning")
            .withNextNodes(List.of(SystemNodes.MAIN_MENU));
        var buttons = FlowNode.Decision.of(50, "Pick", "Choose").withRich("button", "A~10|B~20");

        RepairResult result = repair(FlowFixtures.cleanFlow(target, back, buttons));

        assertThat(decision(result, 50).richContent()).isEqualTo("A~10|B~201");
        assertThat(result.fixLog()).containsExactly("Node 50: replaced orphan reference 20 -> 201");
        assertThat(validator.validateNodes(result.records()).isClean()).isTrue();
    }

    @Test
    void routingGapRoutesMissingOutputsToFirstNonErrorTarget() {
        var detect = new FlowNode.Action(60, "Detect", NodeMeta.empty(), "PlatformDetect", "", "", Map.of(),
            "", "platform", List.of(new Route("ios", 1), new Route("error", 999)));

        RepairResult result = repair(FlowFixtures.cleanFlow(detect));

        assertThat(action(result, 60).whatNext()).containsExactly(
            new Route("ios", 1), new Route("error", 999), new Route("android", 1), new Route("other", 1));
    }

    @Test
    void emptyCommandBecomesVariableAssignment() {
        var empty = new FlowNode.Action(70, "Nothing", NodeMeta.empty(), "", "", "", Map.of(), "", "", List.of());

        RepairResult result = repair(FlowFixtures.cleanFlow(empty));

        FlowNode.Action fixed = action(result, 70);
        assertThat(fixed.command()).isEqualTo("SysAssignVariable");
        assertThat(fixed.paramInput()).isEqualTo("{\"set\":{\"PLACEHOLDER\":\"true\"}}");
        assertThat(fixed.decisionVar()).isEqualTo("success");
        assertThat(fixed.whatNext()).containsExactly(new Route("true", 200), new Route("error", 99990));
    }

    @Test
    void missingDecisionVariableUsesOutputVariable() {
        var lookup = new FlowNode.Action(70, "Lookup", NodeMeta.empty(), "CustomLookup", "", "lookup_result",
            Map.of(), "", "", List.of(new Route("found", 1), new Route("error", 99990)));

        RepairResult result = repair(FlowFixtures.cleanFlow(lookup));

        assertThat(action(result, 70).decisionVar()).isEqualTo("lookup_result");
    }

    @Test
    void deadEndWithoutContentGetsRecoveryButtons() {
        RepairResult result = repair(FlowFixtures.cleanFlow(FlowNode.Decision.of(60, "Stop", "Nothing follows")));

        FlowNode.Decision fixed = decision(result, 60);
        assertThat(fixed.richType()).isEqualTo("button");
        assertThat(fixed.richContent()).isEqualTo("Back to Menu~200|Talk to Agent~999");
        assertThat(fixed.isAnswerRequired()).isTrue();
    }

    @Test
    void datepickerGetsStaticContentAndEmptyMessage() {
        var picker = FlowNode.Decision.of(80, "Date", "Pick a day").withRich("datepicker", "")
            .withNextNodes(List.of(1));

        RepairResult result = repair(FlowFixtures.cleanFlow(picker));

        FlowNode.Decision fixed = decision(result, 80);
        assertThat(fixed.message()).isEmpty();
        assertThat(fixed.richContent()).isEqualTo("{\"type\":\"static\",\"message\":\"Pick a day\"}");
        assertThat(fixed.isAnswerRequired()).isTrue();
        assertThat(fixed.hasBehavior(SystemNodes.DISABLE_INPUT)).isTrue();
    }

    @Test
    void parameterReferenceBindsToPriorAnswer() {
        var ask = FlowNode.Decision.of(10, "Ask", "Your email?").withAnswerRequired(true).withNextNodes(List.of(20));
        var check = new FlowNode.Action(20, "Check", NodeMeta.empty(), "ValidateRegex", "", "", Map.of(),
            "{\"value\":\"{EMAIL}\"}", "valid",
            List.of(new Route("true", 200), new Route("false", 10), new Route("error", 99990)));

        RepairResult result = repair(FlowFixtures.cleanFlow(ask, check));

        assertThat(action(result, 20).nodeInput()).containsExactly(Map.entry("EMAIL", 10));
        assertThat(result.fixLog()).containsExactly("Node 20: bound {EMAIL} to the answer of node 10");
    }

    @Test
    void parameterReferenceSkipsInformationalDecisions() {
        var ask = FlowNode.Decision.of(10, "Ask", "Your email?").withAnswerRequired(true).withNextNodes(List.of(15));
        var thanks = FlowNode.Decision.of(15, "Thanks", "Thanks, checking it now").withNextNodes(List.of(20));
        var check = new FlowNode.Action(20, "Check", NodeMeta.empty(), "ValidateRegex", "", "", Map.of(),
            "{\"value\":\"{EMAIL}\"}", "valid",
            List.of(new Route("true", 200), new Route("false", 10), new Route("error", 99990)));

        RepairResult result = repair(FlowFixtures.cleanFlow(ask, thanks, check));

        assertThat(action(result, 20).nodeInput()).containsExactly(Map.entry("EMAIL", 10));
        assertThat(action(result, 20).paramInput()).isEqualTo("{\"value\":\"{EMAIL}\"}");
        assertThat(result.fixLog()).containsExactly("Node 20: bound {EMAIL} to the answer of node 10");
    }

    @Test
    void unavailableMessageVariableIsRemoved() {
        var greet = FlowNode.Decision.of(30, "Greet", "Hello {NAME} there").withNextNodes(List.of(200));

        RepairResult result = repair(FlowFixtures.cleanFlow(greet));

        assertThat(decision(result, 30).message()).isEqualTo("Hello there");
    }

    @Test
    void injectsEntryAndSystemNodes() {
        var menu = FlowNode.Decision.of(200, "Menu", "Pick").withRich("button", "End~666");

        RepairResult result = repair(List.of(menu));

        assertThat(result.fixLog()).contains(
            "Injected missing entry node 1 routing to 200",
            "Injected missing required system node 666");
        assertThat(result.document().ids()).contains(1, 200, -500, 666, 999, 1800, 99990);
        assertThat(validator.validateNodes(result.records()).isClean()).isTrue();
    }

    @Test
    void duplicateIdsKeepFirstOccurrence() {
        var first = FlowNode.Decision.of(5, "First", "a").withNextNodes(List.of(200));
        var second = FlowNode.Decision.of(5, "Second", "b").withNextNodes(List.of(200));

        RepairResult result = repair(FlowFixtures.cleanFlow(first, second));

        assertThat(decision(result, 5).name()).isEqualTo("First");
        assertThat(decision(result, 6).name()).isEqualTo("Second");
        assertThat(result.fixLog()).containsExactly("duplicate node 5 (Second) renumbered to 6");
    }

    @Test
    void nluDisabledFanOutReEnablesNlu() {
        var choose = FlowNode.Decision.of(10, "Choose", "Pick one").withNluDisabled(true)
            .withRich("button", "A~1|B~200");

        RepairResult result = repair(FlowFixtures.cleanFlow(choose));

        assertThat(decision(result, 10).nluDisabled()).isNull();
    }

    @Test
    void repairingTwiceWithTheSameDiagnosticsChangesNothingMore() {
        var detect = new FlowNode.Action(60, "Detect", NodeMeta.empty(), "PlatformDetect", "", "", Map.of(),
            "", "platform", List.of(new Route("ios", 1), new Route("error", 999)));
        var report = validator.validateNodes(FlowFixtures.cleanFlow(detect, FlowNode.Decision.of(61, "Stop", "x")));

        RepairResult once = engine.repair(report);
        RepairResult twice = engine.repair(once.records(), report.diagnostics());

        assertThat(twice.records()).isEqualTo(once.records());
        assertThat(twice.fixLog()).isEmpty();
    }

    @Test
    void inputListIsNotModified() {
        var nodes = new ArrayList<>(FlowFixtures.cleanFlow(FlowNode.Decision.of(60, "Stop", "x")));
        var copy = List.copyOf(nodes);

        engine.repair(validator.validateNodes(nodes));

        assertThat(nodes).isEqualTo(copy);
    }

    private RepairResult repair(List<FlowNode> nodes) {
        return engine.repair(validator.validateNodes(nodes));
    }

    private static FlowNode.Decision decision(RepairResult result, int id) {
        return (FlowNode.Decision) result.document().node(id).orElseThrow();
    }

    private static FlowNode.Action action(RepairResult result, int id) {
        return (FlowNode.Action) result.document().node(id).orElseThrow();
    }
}
