package com.finclinic.backend.services.insights;

/**
 * Demographic condition an insight variant is written for.
 * Declaration order is the resolution order: the first tag that is present in a bucket and
 * holds for the respondent wins.
 */
public enum ConditionTag {
    INCOME_ABOVE_30K("income_above_30k"),
    INCOME_BELOW_30K("income_below_30k"),
    EMIRATI_WOMAN("emirati_woman"),
    CHILDREN_ZERO("children_zero"),
    CHILDREN_ABOVE_ZERO("children_above_zero"),
    ELSE("else"),
    DEFAULT("default");

    private final String code;

    ConditionTag(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
