package dev.flowdoctor.model;

import java.util.OptionalInt;

/**
 * A label/destination pair from rich asset content, in either pipe or JSON form.
 * Destinations are kept as text because list pickers carry them as strings.
 */
public record Button(String label, String dest) {

    public Button {
        label = label == null ? "" : label.trim();
        dest = dest == null ? "" : dest.trim();
    }

    public OptionalInt target() {
        return NodeIds.parse(dest);
    }

    public Button withDest(int newDest) {
        return new Button(label, Integer.toString(newDest));
    }

    public String render() {
        return label + "~" + dest;
    }
}
