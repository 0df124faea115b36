package com.finclinic.backend.services.insights;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.finclinic.backend.config.AssessmentProperties;
import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.services.AssessmentProfile;
import com.finclinic.backend.services.scoring.CategoryScore;

import lombok.extern.slf4j.Slf4j;

/**
 * Picks advisory messages for the weakest categories of an assessment.
 *
 * Categories are ranked by contribution (lowest first, ties by category priority) and the top
 * {@code maxInsights} are resolved against the {@link InsightMatrix}. Condition tags are
 * tried in {@link ConditionTag} declaration order; income framing therefore always takes
 * precedence over nationality and family framing.
 */
@Slf4j
@Service
public class InsightSelector {

    private static final Comparator<CategoryScore> WEAKEST_FIRST = Comparator
            .comparing(CategoryScore::roundedContribution)
            .thenComparingInt(score -> score.category().getPriority());

    private final InsightMatrix insightMatrix;
    private final AssessmentProperties properties;

    public InsightSelector(InsightMatrix insightMatrix, AssessmentProperties properties) {
        this.insightMatrix = insightMatrix;
        this.properties = properties;
    }

    public List<Insight> selectInsights(Map<FinancialCategory, CategoryScore> categoryScores, AssessmentProfile profile) {
        return selectInsights(categoryScores, profile, properties.maxInsights());
    }

    /**
     * @return at most {@code maxInsights} insights, weakest category first; categories whose
     *         bucket is empty are skipped, never padded
     */
    public List<Insight> selectInsights(
            Map<FinancialCategory, CategoryScore> categoryScores,
            AssessmentProfile profile,
            int maxInsights
    ) {
        if (maxInsights < 0) {
            throw new IllegalArgumentException("maxInsights must be >= 0, got " + maxInsights);
        }
        Objects.requireNonNull(profile, "profile");
        if (categoryScores == null || categoryScores.isEmpty() || maxInsights == 0) {
            return List.of();
        }

        List<CategoryScore> ranked = rank(categoryScores);

        List<Insight> insights = new ArrayList<>();
        for (CategoryScore score : ranked.subList(0, Math.min(maxInsights, ranked.size()))) {
            resolve(score.category(), score.statusLevel(), profile).ifPresent(insights::add);
        }
        return insights;
    }

    /**
     * Resolves the single message for one bucket, or empty when the bucket has none.
     */
    public Optional<Insight> resolve(FinancialCategory category, CategoryStatus status, AssessmentProfile profile) {
        List<InsightVariant> bucket = insightMatrix.bucket(category, status);
        if (bucket.isEmpty()) {
            return Optional.empty();
        }

        for (InsightVariant variant : bucket) {
            if (applies(variant.tag(), profile)) {
                return Optional.of(new Insight(category, status, variant.tag(), variant.text(), category.getPriority()));
            }
        }

        log.warn("No insight variant applies to {}/{} (matrix {}); category omitted",
                category.getDisplayName(), status.getCode(), insightMatrix.version());
        return Optional.empty();
    }

    List<CategoryScore> rank(Map<FinancialCategory, CategoryScore> categoryScores) {
        List<CategoryScore> ranked = new ArrayList<>(categoryScores.values());
        ranked.removeIf(Objects::isNull);
        ranked.sort(WEAKEST_FIRST);
        return ranked;
    }

    boolean applies(ConditionTag tag, AssessmentProfile profile) {
        return switch (tag) {
            case INCOME_ABOVE_30K -> profile.incomeBracket() != null && profile.incomeBracket().isHigh();
            case INCOME_BELOW_30K -> profile.incomeBracket() != null && !profile.incomeBracket().isHigh();
            case EMIRATI_WOMAN -> matches(profile.nationality(), properties.localNationality())
                    && matches(profile.gender(), properties.femaleGender());
            case CHILDREN_ZERO -> profile.dependents() == 0;
            case CHILDREN_ABOVE_ZERO -> profile.dependents() > 0;
            case ELSE, DEFAULT -> true;
        };
    }

    private static boolean matches(String value, String expected) {
        if (value == null) {
            return false;
        }
        return value.trim().toLowerCase(Locale.ROOT).equals(expected.trim().toLowerCase(Locale.ROOT));
    }
}
