package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Clean-up applied to text read from the page before it is compared. */
public enum ValueTransform {
    @JsonProperty("none")            NONE,
    @JsonProperty("stripCurrency")   STRIP_CURRENCY,
    @JsonProperty("stripNonNumeric") STRIP_NON_NUMERIC,
    @JsonProperty("removeChars")     REMOVE_CHARS,
    @JsonProperty("regexReplace")    REGEX_REPLACE
}
