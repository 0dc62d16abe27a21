package dev.flowdoctor;

import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.RawRow;
import dev.flowdoctor.model.SystemNodes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Small flows shared by tests.
 */
public final class FlowFixtures {

    private FlowFixtures() {}

    /** Entry node routing to a main menu, plus every required system node. Validates clean. */
    public static List<FlowNode> cleanFlow(FlowNode... extra) {
        var nodes = new ArrayList<FlowNode>();
        nodes.add(FlowNode.Decision.of(1, "Start", "Welcome!").withNextNodes(List.of(SystemNodes.MAIN_MENU)));
        nodes.add(FlowNode.Decision.of(SystemNodes.MAIN_MENU, "Main Menu", "What would you like to do?")
            .withRich("button", "Talk to Agent~999|End Chat~666")
            .withAnswerRequired(true));
        nodes.addAll(Arrays.asList(extra));
        nodes.addAll(SystemNodes.required().values());
        return nodes;
    }

    public static String csv(List<FlowNode> nodes) {
        return FlowCsvCodec.write(new FlowDocument(nodes));
    }

    /** A 26-cell row with the given columns set and everything else empty. */
    public static RawRow row(int lineNumber, Map<Column, String> values) {
        var cells = new ArrayList<String>();
        for (Column column : Column.values()) {
            cells.add(values.getOrDefault(column, ""));
        }
        return new RawRow(lineNumber, cells);
    }

    public static String withHeader(RawRow... rows) {
        var all = new ArrayList<RawRow>();
        all.add(RawRow.header());
        all.addAll(Arrays.asList(rows));
        return FlowCsvCodec.serialize(all);
    }
}
