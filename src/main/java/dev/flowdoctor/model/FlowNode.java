package dev.flowdoctor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One node of a flow document. Exactly one of two forms: a Decision that talks to the
 * user and routes on their input, or an Action that runs a command and routes on its result.
 * Fields of the other kind cannot be represented.
 */
public sealed interface FlowNode {

    int id();

    String name();

    NodeMeta meta();

    NodeKind kind();

    FlowNode withId(int newId);

    FlowNode withMeta(NodeMeta newMeta);

    /** Presents content and routes by user input. */
    record Decision(
        int id,
        String name,
        NodeMeta meta,
        String entityType,
        String entity,
        Boolean nluDisabled, // null for an empty cell
        List<Integer> nextNodes,
        String message,
        String richType,
        String richContent,
        Boolean answerRequired, // null for an empty cell
        Set<String> behaviors
    ) implements FlowNode {

        public Decision {
            name = name == null ? "" : name;
            meta = meta == null ? NodeMeta.empty() : meta;
            entityType = entityType == null ? "" : entityType;
            entity = entity == null ? "" : entity;
            nextNodes = nextNodes == null ? List.of() : List.copyOf(nextNodes);
            message = message == null ? "" : message;
            richType = richType == null ? "" : richType;
            richContent = richContent == null ? "" : richContent;
            behaviors = behaviors == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(behaviors));
        }

        /** Minimal decision with a message and nothing else. */
        public static Decision of(int id, String name, String message) {
            return new Decision(id, name, NodeMeta.empty(), "", "", null, List.of(), message,
                "", "", null, Set.of());
        }

        @Override
        public NodeKind kind() { return NodeKind.DECISION; }

        public boolean hasBehavior(String behavior) {
            return behaviors.contains(behavior);
        }

        public boolean isAnswerRequired() {
            return Boolean.TRUE.equals(answerRequired);
        }

        public boolean isNluDisabled() {
            return Boolean.TRUE.equals(nluDisabled);
        }

        @Override
        public Decision withId(int newId) {
            return new Decision(newId, name, meta, entityType, entity, nluDisabled, nextNodes,
                message, richType, richContent, answerRequired, behaviors);
        }

        @Override
        public Decision withMeta(NodeMeta newMeta) {
            return new Decision(id, name, newMeta, entityType, entity, nluDisabled, nextNodes,
                message, richType, richContent, answerRequired, behaviors);
        }

        public Decision withNluDisabled(Boolean value) {
            return new Decision(id, name, meta, entityType, entity, value, nextNodes,
                message, richType, richContent, answerRequired, behaviors);
        }

        public Decision withNextNodes(List<Integer> value) {
            return new Decision(id, name, meta, entityType, entity, nluDisabled, value,
                message, richType, richContent, answerRequired, behaviors);
        }

        public Decision withMessage(String value) {
            return new Decision(id, name, meta, entityType, entity, nluDisabled, nextNodes,
                value, richType, richContent, answerRequired, behaviors);
        }

        public Decision withRich(String type, String content) {
            return new Decision(id, name, meta, entityType, entity, nluDisabled, nextNodes,
                message, type, content, answerRequired, behaviors);
        }

        public Decision withRichContent(String content) {
            return withRich(richType, content);
        }

        public Decision withAnswerRequired(Boolean value) {
            return new Decision(id, name, meta, entityType, entity, nluDisabled, nextNodes,
                message, richType, richContent, value, behaviors);
        }

        public Decision withBehaviors(Set<String> value) {
            return new Decision(id, name, meta, entityType, entity, nluDisabled, nextNodes,
                message, richType, richContent, answerRequired, value);
        }

        public Decision plusBehavior(String behavior) {
            var updated = new LinkedHashSet<>(behaviors);
            updated.add(behavior);
            return withBehaviors(updated);
        }
    }

    /** Runs a server-side command and routes by its result. */
    record Action(
        int id,
        String name,
        NodeMeta meta,
        String command,
        String description,
        String outputVar,
        Map<String, Integer> nodeInput,
        String paramInput,
        String decisionVar,
        List<Route> whatNext
    ) implements FlowNode {

        public Action {
            name = name == null ? "" : name;
            meta = meta == null ? NodeMeta.empty() : meta;
            command = command == null ? "" : command;
            description = description == null ? "" : description;
            outputVar = outputVar == null ? "" : outputVar;
            nodeInput = nodeInput == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodeInput));
            paramInput = paramInput == null ? "" : paramInput;
            decisionVar = decisionVar == null ? "" : decisionVar;
            whatNext = whatNext == null ? List.of() : List.copyOf(whatNext);
        }

        @Override
        public NodeKind kind() { return NodeKind.ACTION; }

        public boolean routes(String value) {
            return whatNext.stream().anyMatch(r -> r.value().equalsIgnoreCase(value));
        }

        @Override
        public Action withId(int newId) {
            return new Action(newId, name, meta, command, description, outputVar, nodeInput,
                paramInput, decisionVar, whatNext);
        }

        @Override
        public Action withMeta(NodeMeta newMeta) {
            return new Action(id, name, newMeta, command, description, outputVar, nodeInput,
                paramInput, decisionVar, whatNext);
        }

        public Action withCommand(String value) {
            return new Action(id, name, meta, value, description, outputVar, nodeInput,
                paramInput, decisionVar, whatNext);
        }

        public Action withNodeInput(Map<String, Integer> value) {
            return new Action(id, name, meta, command, description, outputVar, value,
                paramInput, decisionVar, whatNext);
        }

        public Action withParamInput(String value) {
            return new Action(id, name, meta, command, description, outputVar, nodeInput,
                value, decisionVar, whatNext);
        }

        public Action withDecisionVar(String value) {
            return new Action(id, name, meta, command, description, outputVar, nodeInput,
                paramInput, value, whatNext);
        }

        public Action withWhatNext(List<Route> value) {
            return new Action(id, name, meta, command, description, outputVar, nodeInput,
                paramInput, decisionVar, value);
        }
    }
}
