package dev.flowdoctor.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Columns shared by both node kinds.
 */
public record NodeMeta(
    String intent,
    String tags,
    String skillTag,
    Set<String> variables,
    String platformFlag,
    String flows,
    String cssClass
) {
    public NodeMeta {
        intent = intent == null ? "" : intent;
        tags = tags == null ? "" : tags;
        skillTag = skillTag == null ? "" : skillTag;
        variables = variables == null
            ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        platformFlag = platformFlag == null ? "" : platformFlag;
        flows = flows == null ? "" : flows;
        cssClass = cssClass == null ? "" : cssClass;
    }

    public static NodeMeta empty() {
        return new NodeMeta("", "", "", Set.of(), "", "", "");
    }

    public static NodeMeta withVariables(String... names) {
        return empty().withVariables(new LinkedHashSet<>(List.of(names)));
    }

    public NodeMeta withIntent(String newIntent) {
        return new NodeMeta(newIntent, tags, skillTag, variables, platformFlag, flows, cssClass);
    }

    public NodeMeta withVariables(Set<String> newVariables) {
        return new NodeMeta(intent, tags, skillTag, newVariables, platformFlag, flows, cssClass);
    }
}
