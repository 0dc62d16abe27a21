package dev.flowdoctor.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The 26 fixed columns of the flow CSV dialect, in wire order.
 * Each column belongs to Decision nodes, Action nodes, or both.
 */
public enum Column {
    NODE_NUMBER("Node Number", Owner.SHARED, "node_number"),
    NODE_TYPE("Node Type", Owner.SHARED, "node_type"),
    NODE_NAME("Node Name", Owner.SHARED, "node_name"),
    INTENT("Intent", Owner.SHARED, "intent"),
    ENTITY_TYPE("Entity Type", Owner.DECISION, "entity_type"),
    ENTITY("Entity", Owner.DECISION, "entity"),
    NLU_DISABLED("NLU Disabled?", Owner.DECISION, "nlu_disabled"),
    NEXT_NODES("Next Nodes", Owner.DECISION, "next_nodes", "Destination", "Default Destination"),
    MESSAGE("Message", Owner.DECISION, "message"),
    RICH_TYPE("Rich Asset Type", Owner.DECISION, "rich_asset_type"),
    RICH_CONTENT("Rich Asset Content", Owner.DECISION, "rich_asset_content"),
    ANSWER_REQUIRED("Answer Required?", Owner.DECISION, "answer_required", "ans_req"),
    BEHAVIORS("Behaviors", Owner.DECISION, "behaviors"),
    COMMAND("Command", Owner.ACTION, "command", "action_script", "Action Script"),
    DESCRIPTION("Description", Owner.ACTION, "description"),
    OUTPUT("Output", Owner.ACTION, "output"),
    NODE_INPUT("Node Input", Owner.ACTION, "node_input"),
    PARAM_INPUT("Parameter Input", Owner.ACTION, "parameter_input"),
    DECISION_VARIABLE("Decision Variable", Owner.ACTION, "decision_variable", "dir_field"),
    WHAT_NEXT("What Next?", Owner.ACTION, "what_next"),
    NODE_TAGS("Node Tags", Owner.SHARED, "node_tags"),
    SKILL_TAG("Skill Tag", Owner.SHARED, "skill_tag"),
    VARIABLE("Variable", Owner.SHARED, "variable"),
    PLATFORM_FLAG("Platform Flag", Owner.SHARED, "platform_flag"),
    FLOWS("Flows", Owner.SHARED, "flows"),
    CSS_CLASSNAME("CSS Classname", Owner.SHARED, "css_classname");

    /** Which node kind a column belongs to. */
    public enum Owner { SHARED, DECISION, ACTION }

    public static final int COUNT = 26;

    private static final Map<String, Column> BY_NAME = new HashMap<>();

    static {
        for (Column column : values()) {
            BY_NAME.put(column.header.toLowerCase(Locale.ROOT), column);
            for (String alias : column.aliases) {
                BY_NAME.put(alias.toLowerCase(Locale.ROOT), column);
            }
        }
    }

    private final String header;
    private final Owner owner;
    private final List<String> aliases;

    Column(String header, Owner owner, String... aliases) {
        this.header = header;
        this.owner = owner;
        this.aliases = List.of(aliases);
    }

    public String header() { return header; }
    public Owner owner() { return owner; }
    public int index() { return ordinal(); }

    public boolean belongsTo(NodeKind kind) {
        return switch (owner) {
            case SHARED -> true;
            case DECISION -> kind == NodeKind.DECISION;
            case ACTION -> kind == NodeKind.ACTION;
        };
    }

    public static Column at(int index) {
        return values()[index];
    }

    /**
     * Resolve a header name, snake_case name or alias as used by external validators.
     */
    public static Optional<Column> byName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public static List<String> headers() {
        return Arrays.stream(values()).map(Column::header).toList();
    }
}
