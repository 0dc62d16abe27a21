package dev.flowdoctor.model;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * One place where a node id is used as a routing target.
 *
 * @param source the node holding the reference
 * @param site   where inside the node the reference lives
 * @param label  button label or route value; empty for next nodes
 * @param target the referenced node id
 */
public record Reference(int source, Site site, String label, int target) {

    /** Where a reference is written. */
    public enum Site {
        NEXT_NODES(Column.NEXT_NODES),
        WHAT_NEXT(Column.WHAT_NEXT),
        PIPE_BUTTON(Column.RICH_CONTENT),
        JSON_OPTION(Column.RICH_CONTENT);

        private final Column column;

        Site(Column column) {
            this.column = column;
        }

        public Column column() { return column; }
    }

    public Reference {
        label = label == null ? "" : label;
    }

    public Column column() {
        return site.column();
    }

    /**
     * All references held by a node, in column order.
     * Button destinations that are not bare integers are not references.
     */
    public static List<Reference> of(FlowNode node) {
        var refs = new ArrayList<Reference>();
        if (node instanceof FlowNode.Decision decision) {
            for (int target : decision.nextNodes()) {
                refs.add(new Reference(node.id(), Site.NEXT_NODES, "", target));
            }
            RichContent rich = RichContent.parse(decision.richContent());
            if (rich instanceof RichContent.Pipe pipe) {
                addButtons(refs, node.id(), Site.PIPE_BUTTON, pipe.buttons());
            } else if (rich instanceof RichContent.Json json) {
                addButtons(refs, node.id(), Site.JSON_OPTION, json.options());
            }
        } else if (node instanceof FlowNode.Action action) {
            for (Route route : action.whatNext()) {
                refs.add(new Reference(node.id(), Site.WHAT_NEXT, route.value(), route.target()));
            }
        }
        return refs;
    }

    private static void addButtons(List<Reference> refs, int source, Site site, List<Button> buttons) {
        for (Button button : buttons) {
            OptionalInt target = button.target();
            if (target.isPresent()) {
                refs.add(new Reference(source, site, button.label(), target.getAsInt()));
            }
        }
    }
}
