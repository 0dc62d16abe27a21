package dev.flowdoctor.engine;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeMeta;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VariableScopeTest {

    @Test
    void referencesAreDistinctInOrder() {
        assertThat(VariableScope.references("Hi {NAME}, {NAME} is {AGE}")).containsExactly("NAME", "AGE");
        assertThat(VariableScope.references("no braces")).isEmpty();
    }

    @Test
    void earlierDeclarationIsVisibleRegardlessOfCase() {
        var declaring = FlowNode.Decision.of(5, "Ask", "Your name?").withMeta(NodeMeta.withVariables("NAME"));
        var using = FlowNode.Decision.of(10, "Greet", "Hi {name}");

        assertThat(VariableScope.analyze(List.of(using, declaring))).isEmpty();
    }

    @Test
    void laterDeclarationIsNotVisible() {
        var using = FlowNode.Decision.of(5, "Greet", "Hi {NAME}");
        var declaring = FlowNode.Decision.of(10, "Ask", "Your name?").withMeta(NodeMeta.withVariables("NAME"));

        List<Diagnostic> diagnostics = VariableScope.analyze(List.of(using, declaring));

        assertThat(diagnostics).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.UNBOUND_VARIABLE);
            assertThat(d.nodeId()).isEqualTo(5);
            assertThat(d.field()).isEqualTo(Column.MESSAGE);
            assertThat(d.payload()).isEqualTo("NAME");
        });
    }

    @Test
    void systemVariablesAreAlwaysAvailable() {
        assertThat(VariableScope.analyze(List.of(FlowNode.Decision.of(5, "Id", "Chat {CHATID}")))).isEmpty();
    }

    @Test
    void nodeInputBindsForItsOwnNode() {
        var action = new FlowNode.Action(10, "Check", null, "ValidateRegex", "", "", Map.of("EMAIL", 5),
            "{\"value\":\"{EMAIL}\"}", "valid", List.of());

        assertThat(VariableScope.analyze(List.of(action))).isEmpty();
    }
}
