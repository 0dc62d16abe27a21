package dev.flowdoctor.backend;

import java.util.List;

/**
 * Proposes a corrected document for errors the deterministic rules could not fix.
 */
public interface GenerativeRepairer {

    /**
     * @param csv       current document text
     * @param errors    only the errors left for this call
     * @param iteration refinement iteration, starting at 1
     * @param hints     previously learned fixes for these errors, possibly empty
     */
    RepairProposal propose(String csv, List<ExternalError> errors, int iteration, List<FixHint> hints);
}
