package com.labsignal.reasoning.api;

import com.labsignal.reasoning.api.model.ClinicalSignals;
import com.labsignal.reasoning.api.model.RuleMatch;

import java.util.List;

/**
 * Folds rule matches into a deduplicated signal bundle by walking the
 * finding-to-condition and condition-to-action edges of the catalog.
 */
public interface ISignalAggregator {

    ClinicalSignals aggregate(List<RuleMatch> matches);
}
