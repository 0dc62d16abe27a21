package dev.flowdoctor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Reserved node ids every flow document relies on, and the canonical nodes injected when one is missing.
 */
public final class SystemNodes {

    public static final int ERROR_HANDLER = -500;
    public static final int MAIN_MENU = 200;
    public static final int RETURN_TO_MENU = 201;
    public static final int END_CHAT = 666;
    public static final int AGENT_TRANSFER = 999;
    public static final int OUT_OF_SCOPE = 1800;
    public static final int GENAI_ANSWER = 1802;
    public static final int INTENT_ROUTING = 1803;
    public static final int HUMAN_HELP = 1804;
    public static final int ERROR_MESSAGE = 99990;

    public static final String XFER_TO_AGENT = "xfer_to_agent";
    public static final String DISABLE_INPUT = "disable_input";

    /** Ids that generated flows must never claim. */
    public static final Set<Integer> RESERVED_IDS = Set.of(
        ERROR_HANDLER, END_CHAT, AGENT_TRANSFER,
        OUT_OF_SCOPE, 1801, GENAI_ANSWER, INTENT_ROUTING, HUMAN_HELP, ERROR_MESSAGE
    );

    private static final String RECOVERY_BUTTONS = "Start Over~1|Talk to Agent~" + AGENT_TRANSFER;

    private static final Map<Integer, FlowNode> REQUIRED = buildRequired();

    private SystemNodes() {}

    /** The nodes a document must contain, in injection order. */
    public static Map<Integer, FlowNode> required() {
        return REQUIRED;
    }

    public static boolean isRequired(int id) {
        return REQUIRED.containsKey(id);
    }

    public static boolean isReserved(int id) {
        return RESERVED_IDS.contains(id);
    }

    /** Designated return-to-menu node if the document has one, else the main menu, else none. */
    public static OptionalInt menuNode(Set<Integer> ids) {
        if (ids.contains(RETURN_TO_MENU)) {
            return OptionalInt.of(RETURN_TO_MENU);
        }
        if (ids.contains(MAIN_MENU)) {
            return OptionalInt.of(MAIN_MENU);
        }
        return OptionalInt.empty();
    }

    private static Map<Integer, FlowNode> buildRequired() {
        var nodes = new LinkedHashMap<Integer, FlowNode>();
        nodes.put(ERROR_HANDLER, new FlowNode.Action(
            ERROR_HANDLER, "HandleBotError", NodeMeta.withVariables("PLATFORM_ERROR"),
            "HandleBotError", "Catches exceptions", "error_type", Map.of(),
            "{\"save_error_to\":\"PLATFORM_ERROR\"}", "error_type",
            List.of(new Route("bot_error", ERROR_MESSAGE),
                new Route("bot_timeout", ERROR_MESSAGE),
                new Route("other", ERROR_MESSAGE))));
        nodes.put(END_CHAT, FlowNode.Decision.of(END_CHAT, "EndChat",
            "Thank you for using our service. Goodbye!"));
        nodes.put(AGENT_TRANSFER, FlowNode.Decision.of(AGENT_TRANSFER, "Agent Transfer", "")
            .plusBehavior(XFER_TO_AGENT));
        nodes.put(OUT_OF_SCOPE, FlowNode.Decision.of(OUT_OF_SCOPE, "OutOfScope", "I'm not sure I understood that.")
            .withMeta(NodeMeta.empty().withIntent("out_of_scope"))
            .withRich("button", RECOVERY_BUTTONS)
            .withAnswerRequired(true)
            .plusBehavior(DISABLE_INPUT));
        nodes.put(ERROR_MESSAGE, FlowNode.Decision.of(ERROR_MESSAGE, "Error Message",
                "Oops! Something went wrong. Let me help you get back on track.")
            .withRich("button", RECOVERY_BUTTONS)
            .withAnswerRequired(true)
            .plusBehavior(DISABLE_INPUT));
        return Collections.unmodifiableMap(nodes);
    }
}
