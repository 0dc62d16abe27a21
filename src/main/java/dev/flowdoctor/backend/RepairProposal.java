package dev.flowdoctor.backend;

import java.util.List;

/**
 * Document proposed by the generative repairer.
 */
public record RepairProposal(String csv, List<String> fixesMade, List<String> stillBroken) {

    public RepairProposal {
        csv = csv == null ? "" : csv;
        fixesMade = fixesMade == null ? List.of() : List.copyOf(fixesMade);
        stillBroken = stillBroken == null ? List.of() : List.copyOf(stillBroken);
    }
}
