package dev.flowdoctor.config;

import dev.flowdoctor.model.AllocationBands;
import dev.flowdoctor.model.RefinementSettings;

/**
 * Everything a settings file can configure.
 */
public record Settings(RefinementSettings refinement, AllocationBands bands) {

    public static Settings defaults() {
        return new Settings(RefinementSettings.defaults(), AllocationBands.defaults());
    }

    public Settings withRefinement(RefinementSettings value) {
        return new Settings(value, bands);
    }
}
