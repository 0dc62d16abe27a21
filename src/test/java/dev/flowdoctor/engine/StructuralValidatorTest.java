package dev.flowdoctor.engine;

import dev.flowdoctor.FlowFixtures;
import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeMeta;
import dev.flowdoctor.model.RawRow;
import dev.flowdoctor.model.Route;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralValidatorTest {

    private final StructuralValidator validator = StructuralValidator.withBuiltInContract();

    @Test
    void cleanFlowHasNoDiagnostics() {
        ValidationReport report = validator.validate(FlowCsvCodec.parse(FlowFixtures.csv(FlowFixtures.cleanFlow())));

        assertThat(report.diagnostics()).isEmpty();
        assertThat(report.records()).hasSize(7);
    }

    @Test
    void reportsMissingEntryAndSystemNodes() {
        ValidationReport report = validator.validateNodes(List.of(
            FlowNode.Decision.of(5, "Lonely", "Hi").withNextNodes(List.of(5))));

        assertThat(report.has(DiagnosticKind.MISSING_ENTRY_NODE)).isTrue();
        assertThat(report.ofKind(DiagnosticKind.MISSING_SYSTEM_NODE))
            .extracting(Diagnostic::payload)
            .containsExactlyInAnyOrder("-500", "666", "999", "1800", "99990");
    }

    @Test
    void dropsRowsWithNonIntegerNodeNumbers() {
        String csv = FlowFixtures.withHeader(
            FlowFixtures.row(2, Map.of(Column.NODE_NUMBER, "1abc", Column.NODE_TYPE, "D")));

        ValidationReport report = validator.validate(FlowCsvCodec.parse(csv));

        assertThat(report.records()).isEmpty();
        assertThat(report.malformed()).hasSize(1);
        assertThat(report.has(DiagnosticKind.NON_INTEGER_ID)).isTrue();
    }

    @Test
    void reportsDuplicateIds() {
        var nodes = FlowFixtures.cleanFlow(
            FlowNode.Decision.of(5, "First", "a").withNextNodes(List.of(200)),
            FlowNode.Decision.of(5, "Second", "b").withNextNodes(List.of(200)));

        assertThat(validator.validateNodes(nodes).ofKind(DiagnosticKind.DUPLICATE_ID))
            .singleElement()
            .extracting(Diagnostic::nodeId)
            .isEqualTo(5);
    }

    @Test
    void infersKindOfUnknownNodeType() {
        String csv = FlowFixtures.withHeader(FlowFixtures.row(2, Map.of(
            Column.NODE_NUMBER, "10", Column.NODE_TYPE, "Q", Column.COMMAND, "PlatformDetect")));

        ValidationReport report = validator.validate(FlowCsvCodec.parse(csv));

        assertThat(report.records().get(0)).isInstanceOf(FlowNode.Action.class);
        assertThat(report.has(DiagnosticKind.UNKNOWN_NODE_TYPE)).isTrue();
    }

    @Test
    void reportsInvalidFlagsAndCrossKindFields() {
        String csv = FlowFixtures.withHeader(FlowFixtures.row(2, Map.of(
            Column.NODE_NUMBER, "1", Column.NODE_TYPE, "D", Column.NLU_DISABLED, "maybe",
            Column.NEXT_NODES, "666", Column.COMMAND, "PlatformDetect")));

        ValidationReport report = validator.validate(FlowCsvCodec.parse(csv));

        assertThat(report.ofKind(DiagnosticKind.INVALID_FLAG)).extracting(Diagnostic::payload).containsExactly("maybe");
        assertThat(report.ofKind(DiagnosticKind.CROSS_KIND_FIELD)).extracting(Diagnostic::field)
            .containsExactly(Column.COMMAND);
    }

    @Test
    void reportsOverflowingRowAsColumnCount() {
        var cells = new ArrayList<>(FlowFixtures.row(2, Map.of(
            Column.NODE_NUMBER, "1", Column.NODE_TYPE, "D", Column.NEXT_NODES, "666")).cells());
        cells.add("extra");

        ValidationReport report = validator.validate(List.of(new RawRow(2, cells)));

        assertThat(report.ofKind(DiagnosticKind.COLUMN_COUNT)).singleElement()
            .extracting(Diagnostic::payload).isEqualTo("27");
    }

    @Test
    void reportsUnroutedCommandOutputs() {
        var detect = new FlowNode.Action(10, "Detect", NodeMeta.empty(), "PlatformDetect", "", "", Map.of(),
            "", "platform", List.of(new Route("ios", 1), new Route("error", 999)));

        ValidationReport report = validator.validateNodes(FlowFixtures.cleanFlow(detect));

        assertThat(report.ofKind(DiagnosticKind.ROUTING_GAP)).extracting(Diagnostic::payload)
            .containsExactly("android", "other");
        assertThat(report.has(DiagnosticKind.MISSING_ERROR_PATH)).isFalse();
    }

    @Test
    void reportsMissingErrorPathAndDecisionVariable() {
        var check = new FlowNode.Action(10, "Check", NodeMeta.empty(), "CustomLookup", "", "", Map.of(),
            "", "", List.of(new Route("found", 1)));

        ValidationReport report = validator.validateNodes(FlowFixtures.cleanFlow(check));

        assertThat(report.has(DiagnosticKind.MISSING_ERROR_PATH)).isTrue();
        assertThat(report.has(DiagnosticKind.MISSING_DECISION_VARIABLE)).isTrue();
    }

    @Test
    void reportsNluDisabledWithSeveralDestinations() {
        var node = FlowNode.Decision.of(10, "Choose", "Pick one")
            .withNluDisabled(true)
            .withRich("button", "A~1|B~200");

        assertThat(validator.validateNodes(FlowFixtures.cleanFlow(node)).ofKind(DiagnosticKind.NLU_MULTI_DESTINATION))
            .singleElement()
            .extracting(Diagnostic::payload).isEqualTo("2");
    }

    @Test
    void reportsOrphanReferencesAndDeadEnds() {
        var buttons = FlowNode.Decision.of(50, "Menu", "Pick").withRich("button", "A~1|B~20");
        var deadEnd = FlowNode.Decision.of(60, "Stop", "Nothing follows");

        ValidationReport report = validator.validateNodes(FlowFixtures.cleanFlow(buttons, deadEnd));

        assertThat(report.ofKind(DiagnosticKind.ORPHAN_REFERENCE)).singleElement().satisfies(d -> {
            assertThat(d.nodeId()).isEqualTo(50);
            assertThat(d.payload()).isEqualTo("20");
        });
        assertThat(report.ofKind(DiagnosticKind.DEAD_END)).extracting(Diagnostic::nodeId).containsExactly(60);
    }

    @Test
    void reportsRichContentProblems() {
        var pipeAsButtons = FlowNode.Decision.of(10, "A", "m").withRich("buttons", "Yes~1|No~200");
        var rootDest = FlowNode.Decision.of(11, "B", "m")
            .withRich("listpicker", "{\"type\":\"static\",\"dest\":\"200\",\"options\":[{\"label\":\"X\",\"dest\":\"1\"}]}");
        var numericListpicker = FlowNode.Decision.of(12, "C", "m")
            .withRich("listpicker", "{\"type\":\"static\",\"options\":[{\"label\":\"X\",\"dest\":1}]}");
        var brokenJson = FlowNode.Decision.of(13, "D", "m").withRich("buttons", "{\"options\":[").withNextNodes(List.of(1));

        ValidationReport report = validator.validateNodes(
            FlowFixtures.cleanFlow(pipeAsButtons, rootDest, numericListpicker, brokenJson));

        assertThat(report.ofKind(DiagnosticKind.RICH_TYPE_MISMATCH)).extracting(Diagnostic::nodeId).containsExactly(10);
        assertThat(report.ofKind(DiagnosticKind.ROOT_LEVEL_DEST)).extracting(Diagnostic::nodeId).containsExactly(11);
        assertThat(report.ofKind(DiagnosticKind.DEST_TYPE)).extracting(Diagnostic::nodeId).containsExactly(12);
        assertThat(report.ofKind(DiagnosticKind.MALFORMED_RICH_JSON)).extracting(Diagnostic::nodeId).containsExactly(13);
    }

    @Test
    void reportsPickerRequirements() {
        var picker = FlowNode.Decision.of(10, "Date", "When?").withRich("datepicker", "").withNextNodes(List.of(1));

        ValidationReport report = validator.validateNodes(FlowFixtures.cleanFlow(picker));

        assertThat(report.ofKind(DiagnosticKind.PICKER_CONSTRAINT)).singleElement()
            .extracting(Diagnostic::payload)
            .isEqualTo("answer required, disable_input, message column must be empty, static JSON with message");
    }

    @Test
    void diagnosticsComeInDeterministicOrder() {
        var nodes = FlowFixtures.cleanFlow(
            FlowNode.Decision.of(60, "Stop", "Nothing follows"),
            FlowNode.Decision.of(50, "Menu", "Pick").withRich("button", "A~1|B~20"));

        List<Diagnostic> first = validator.validateNodes(nodes).diagnostics();
        List<Diagnostic> second = validator.validateNodes(List.copyOf(nodes)).diagnostics();

        assertThat(first).isEqualTo(second).isSortedAccordingTo(Diagnostic.ORDER);
    }
}
