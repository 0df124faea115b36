package com.finclinic.backend.services.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.exceptions.CatalogInvariantException;

/**
 * Immutable, revisioned set of assessment questions.
 *
 * Instances only come out of {@link #initialize(String, List)}, which refuses content whose
 * weights do not add up to 100. A new catalog revision is a new instance; nothing here
 * changes after initialisation.
 */
public final class QuestionCatalog {

    public static final int TOTAL_WEIGHT = 100;
    public static final int MIN_ANSWER = 1;
    public static final int MAX_ANSWER = 5;

    private final String revision;
    private final List<Question> questions;
    private final Map<String, Question> byId;
    private final Map<FinancialCategory, List<Question>> byCategory;
    private final Map<FinancialCategory, Integer> categoryWeights;
    private final Question conditionalQuestion;

    private QuestionCatalog(String revision, List<Question> questions, Question conditionalQuestion) {
        this.revision = revision;
        this.questions = questions;
        this.conditionalQuestion = conditionalQuestion;

        Map<String, Question> ids = new LinkedHashMap<>();
        for (Question q : questions) {
            ids.put(q.id(), q);
        }
        this.byId = Collections.unmodifiableMap(ids);

        Map<FinancialCategory, List<Question>> grouped = new EnumMap<>(FinancialCategory.class);
        Map<FinancialCategory, Integer> weights = new EnumMap<>(FinancialCategory.class);
        for (FinancialCategory category : FinancialCategory.values()) {
            List<Question> inCategory = questions.stream()
                    .filter(q -> q.category() == category)
                    .toList();
            grouped.put(category, inCategory);
            weights.put(category, inCategory.stream().mapToInt(Question::weight).sum());
        }
        this.byCategory = Collections.unmodifiableMap(grouped);
        this.categoryWeights = Collections.unmodifiableMap(weights);
    }

    /**
     * Validates and freezes a catalog revision.
     *
     * @throws CatalogInvariantException if weights do not sum to 100, an id repeats, a question
     *         does not offer exactly the values 1..5, a weight is not positive, more than one
     *         question is conditional, or a category has no question
     */
    public static QuestionCatalog initialize(String revision, List<Question> questions) throws CatalogInvariantException {
        if (revision == null || revision.isBlank()) {
            throw new CatalogInvariantException("Catalog revision id is required");
        }
        if (questions == null || questions.isEmpty()) {
            throw new CatalogInvariantException("Catalog " + revision + " has no questions");
        }

        List<Question> ordered = new ArrayList<>(questions);
        ordered.sort(Comparator.comparingInt(Question::number));

        Set<String> seen = new HashSet<>();
        Question conditional = null;
        for (Question q : ordered) {
            if (!seen.add(q.id())) {
                throw new CatalogInvariantException("Catalog " + revision + " repeats question id " + q.id());
            }
            if (q.weight() <= 0) {
                throw new CatalogInvariantException("Question " + q.id() + " must have a positive weight, got " + q.weight());
            }
            Set<Integer> values = q.options().stream().map(AnswerOption::value).collect(Collectors.toSet());
            if (q.options().size() != MAX_ANSWER || !values.equals(Set.of(1, 2, 3, 4, 5))) {
                throw new CatalogInvariantException("Question " + q.id() + " must offer exactly the values 1..5");
            }
            if (q.conditional()) {
                if (conditional != null) {
                    throw new CatalogInvariantException(
                            "Catalog " + revision + " has more than one conditional question: "
                                    + conditional.id() + ", " + q.id());
                }
                conditional = q;
            }
        }

        int total = ordered.stream().mapToInt(Question::weight).sum();
        if (total != TOTAL_WEIGHT) {
            throw new CatalogInvariantException(
                    "Question weights of catalog " + revision + " must sum to " + TOTAL_WEIGHT + ", got " + total);
        }

        for (FinancialCategory category : FinancialCategory.values()) {
            boolean present = ordered.stream().anyMatch(q -> q.category() == category);
            if (!present) {
                throw new CatalogInvariantException("Catalog " + revision + " has no question for " + category.getDisplayName());
            }
        }

        return new QuestionCatalog(revision, List.copyOf(ordered), conditional);
    }

    public String revision() {
        return revision;
    }

    /**
     * Questions shown to a respondent, in display order. The conditional question is left out
     * when the respondent has no dependents.
     */
    public List<Question> questionsFor(int dependentsCount) {
        if (conditionalQuestion == null || dependentsCount > 0) {
            return questions;
        }
        return questions.stream()
                .filter(q -> !q.id().equals(conditionalQuestion.id()))
                .toList();
    }

    public List<Question> allQuestions() {
        return questions;
    }

    public List<Question> questionsIn(FinancialCategory category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public Optional<Question> findQuestion(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<String> conditionalQuestionId() {
        return Optional.ofNullable(conditionalQuestion).map(Question::id);
    }

    public int categoryWeight(FinancialCategory category) {
        return categoryWeights.getOrDefault(category, 0);
    }

    public Map<FinancialCategory, Integer> categoryWeights() {
        return categoryWeights;
    }

    public int totalWeight() {
        return categoryWeights.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "QuestionCatalog{revision=" + revision + ", questions=" + questions.size()
                + ", conditional=" + conditionalQuestionId().orElse("none") + "}";
    }
}
