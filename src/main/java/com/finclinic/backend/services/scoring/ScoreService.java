package com.finclinic.backend.services.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.enums.StatusBand;
import com.finclinic.backend.exceptions.AnswerValidationException;
import com.finclinic.backend.services.catalog.Question;
import com.finclinic.backend.services.catalog.QuestionCatalog;

import lombok.extern.slf4j.Slf4j;

/**
 * Weighted 0-100 scoring of a Financial Clinic submission.
 *
 * Every question contributes {@code answer x weight} points to its category; a category's
 * percentage is scaled by the category weight to get its share of the overall score.
 * The service holds no state: the catalog is passed in so historical submissions can be scored
 * against the revision they were answered under.
 */
@Slf4j
@Service
public class ScoreService {

    /**
     * Returns every problem with the answer set; an empty list means it can be scored.
     * Values are taken as submitted: only an {@link Integer} in [1, 5] is a valid answer, so
     * fractional numbers, numeric strings and booleans are reported rather than coerced.
     */
    public List<AnswerViolation> validate(QuestionCatalog catalog, Map<String, ?> answers, int dependentsCount) {
        requireNonNegative(dependentsCount);
        Map<String, ?> safeAnswers = answers != null ? answers : Map.of();

        List<AnswerViolation> violations = new ArrayList<>();
        for (Question question : catalog.questionsFor(dependentsCount)) {
            if (!safeAnswers.containsKey(question.id())) {
                violations.add(AnswerViolation.missing(question.id(), question.number()));
            }
        }

        for (Question question : catalog.allQuestions()) {
            if (safeAnswers.containsKey(question.id()) && !isValidValue(safeAnswers.get(question.id()))) {
                violations.add(AnswerViolation.invalid(question.id(), safeAnswers.get(question.id())));
            }
        }

        List<String> unknownIds = new ArrayList<>();
        for (String id : safeAnswers.keySet()) {
            if (catalog.findQuestion(id).isEmpty()) {
                unknownIds.add(id);
            }
        }
        Collections.sort(unknownIds);
        for (String id : unknownIds) {
            log.debug("Ignoring answer for unknown question id {} (catalog {})", id, catalog.revision());
            if (!isValidValue(safeAnswers.get(id))) {
                violations.add(AnswerViolation.invalid(id, safeAnswers.get(id)));
            }
        }

        return violations;
    }

    /**
     * Validates and scores a submission.
     *
     * @throws AnswerValidationException with the complete violation list when any answer is
     *         missing or out of range; nothing is scored in that case
     */
    public ScoringResult score(QuestionCatalog catalog, Map<String, ?> answers, int dependentsCount) {
        List<AnswerViolation> violations = validate(catalog, answers, dependentsCount);
        if (!violations.isEmpty()) {
            throw new AnswerValidationException(violations);
        }

        Map<String, Integer> effective = withConditionalDefault(catalog, answers, dependentsCount);

        Map<FinancialCategory, CategoryScore> categoryScores = new EnumMap<>(FinancialCategory.class);
        double sum = 0.0;
        for (FinancialCategory category : FinancialCategory.values()) {
            CategoryScore categoryScore = scoreCategory(catalog, category, effective);
            categoryScores.put(category, categoryScore);
            sum += categoryScore.contribution();
        }

        BigDecimal total = BigDecimal.valueOf(sum).setScale(2, RoundingMode.HALF_UP);
        StatusBand band = StatusClassifier.overallBand(total.doubleValue());

        List<Question> applicable = catalog.questionsFor(dependentsCount);
        int answered = (int) applicable.stream().filter(q -> answers.containsKey(q.id())).count();

        return new ScoringResult(
                catalog.revision(),
                new OverallScore(total, band),
                categoryScores,
                answered,
                applicable.size()
        );
    }

    /**
     * Copy of {@code answers} with the conditional question set to the best value when the
     * respondent has no dependents and was not asked it. The input map is never modified.
     */
    Map<String, Integer> withConditionalDefault(QuestionCatalog catalog, Map<String, ?> answers, int dependentsCount) {
        Map<String, Integer> copy = new HashMap<>();
        for (Map.Entry<String, ?> answer : answers.entrySet()) {
            // validated: every value is an Integer in range
            copy.put(answer.getKey(), (Integer) answer.getValue());
        }
        Optional<String> conditionalId = catalog.conditionalQuestionId();
        if (dependentsCount == 0 && conditionalId.isPresent() && !copy.containsKey(conditionalId.get())) {
            copy.put(conditionalId.get(), QuestionCatalog.MAX_ANSWER);
        }
        return copy;
    }

    private CategoryScore scoreCategory(QuestionCatalog catalog, FinancialCategory category, Map<String, Integer> answers) {
        int actualPoints = 0;
        int maxPoints = 0;
        // weights come from the full catalog, including questions the respondent never saw
        for (Question question : catalog.questionsIn(category)) {
            actualPoints += answers.get(question.id()) * question.weight();
            maxPoints += QuestionCatalog.MAX_ANSWER * question.weight();
        }

        // multiply before dividing so integral percentages stay exact
        double percentage = maxPoints > 0 ? (actualPoints * 100.0) / maxPoints : 0.0;
        int categoryWeight = catalog.categoryWeight(category);
        double contribution = (percentage * categoryWeight) / 100.0;
        CategoryStatus status = StatusClassifier.categoryStatus(percentage);

        return new CategoryScore(category, actualPoints, maxPoints, percentage, contribution, categoryWeight, status);
    }

    private static boolean isValidValue(Object value) {
        return value instanceof Integer answer
                && answer >= QuestionCatalog.MIN_ANSWER
                && answer <= QuestionCatalog.MAX_ANSWER;
    }

    private static void requireNonNegative(int dependentsCount) {
        if (dependentsCount < 0) {
            throw new IllegalArgumentException("dependentsCount must be >= 0, got " + dependentsCount);
        }
    }
}
