package com.finclinic.backend.services.insights;

import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.services.catalog.LocalizedText;

/**
 * @param conditionTag the variant that was selected for this respondent
 * @param priority     the category's fixed tie-break priority
 */
public record Insight(
        FinancialCategory category,
        CategoryStatus statusLevel,
        ConditionTag conditionTag,
        LocalizedText text,
        int priority
) {
}
