package io.teleops.evaluation;

import lombok.Value;

/**
 * Baseline scores against manually labeled incidents.
 */
@Value
public class ManualLabelReport {
    int cases;
    double average;
    double median;
}
