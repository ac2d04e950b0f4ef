package io.teleops.rca;

import io.teleops.domain.model.Alert;
import io.teleops.domain.model.HypothesisResult;

import java.util.List;

/**
 * Anything that proposes root-cause hypotheses for an incident.
 * <p>
 * The baseline rule matcher is the only built-in source; model-backed sources plug in
 * as additional beans and are graded side by side during evaluation.
 */
public interface HypothesisSource {

    /**
     * Stable name used to group evaluation results.
     */
    String name();

    HypothesisResult propose(String incidentSummary, List<Alert> alerts);
}
