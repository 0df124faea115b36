package com.finclinic.backend.services.scoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.finclinic.backend.enums.FinancialCategory;

/**
 * Outcome of scoring one submission against one catalog revision.
 *
 * @param questionsAnswered applicable questions the respondent answered (the substituted
 *                          conditional answer is not counted)
 * @param totalQuestions    questions applicable to the respondent
 */
public record ScoringResult(
        String catalogRevision,
        OverallScore overall,
        Map<FinancialCategory, CategoryScore> categoryScores,
        int questionsAnswered,
        int totalQuestions
) {
    public ScoringResult {
        EnumMap<FinancialCategory, CategoryScore> copy = new EnumMap<>(FinancialCategory.class);
        copy.putAll(categoryScores);
        categoryScores = Collections.unmodifiableMap(copy);
    }

    public CategoryScore categoryScore(FinancialCategory category) {
        return categoryScores.get(category);
    }
}
