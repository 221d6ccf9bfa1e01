package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One observed lab value for a patient, as produced by the extraction pipeline.
 *
 * @param canonicalName normalized test name; must equal a catalog test's canonical name to be used
 * @param numericValue  observed value; null when the report had none, in which case
 *                      the reading is never matched against a threshold
 * @param unit          unit as printed on the report
 * @param abnormalFlag  lab-printed flag; {@link AbnormalFlag#NONE} when absent
 */
public record Reading(
        @JsonProperty("canonical_name") String canonicalName,
        @JsonProperty("value") Double numericValue,
        @JsonProperty("unit") String unit,
        @JsonProperty("abnormal_flag") AbnormalFlag abnormalFlag
) {
    public Reading {
        if (abnormalFlag == null) abnormalFlag = AbnormalFlag.NONE;
    }

    public Reading(String canonicalName, double numericValue, String unit) {
        this(canonicalName, numericValue, unit, AbnormalFlag.NONE);
    }

    public boolean hasValue() {
        return numericValue != null;
    }
}
