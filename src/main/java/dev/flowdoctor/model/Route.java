package dev.flowdoctor.model;

/**
 * One {@code value~target} entry of an Action node's What Next column.
 */
public record Route(String value, int target) {

    public Route {
        value = value == null ? "" : value.trim();
    }

    public boolean isError() {
        return "error".equalsIgnoreCase(value);
    }

    public String render() {
        return value + "~" + target;
    }
}
