package com.finclinic.backend.services;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.finclinic.backend.services.catalog.Question;
import com.finclinic.backend.services.catalog.QuestionCatalog;
import com.finclinic.backend.services.catalog.QuestionCatalogRegistry;
import com.finclinic.backend.services.insights.Insight;
import com.finclinic.backend.services.insights.InsightSelector;
import com.finclinic.backend.services.scoring.ScoreService;
import com.finclinic.backend.services.scoring.ScoringResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssessmentService {

    private final QuestionCatalogRegistry catalogRegistry;
    private final ScoreService scoreService;
    private final InsightSelector insightSelector;

    /**
     * Scores a submission and selects its insights.
     *
     * @param catalogRevision revision the answers were collected under; null for the default
     * @param answers         answer values as submitted; anything but an integer 1-5 is a violation
     */
    public AssessmentResult assess(String catalogRevision, Map<String, ?> answers, AssessmentProfile profile) {
        QuestionCatalog catalog = catalogRegistry.resolve(catalogRevision);

        ScoringResult scoring = scoreService.score(catalog, answers, profile.dependents());
        List<Insight> insights = insightSelector.selectInsights(scoring.categoryScores(), profile);

        log.info("Assessment scored: catalog={}, total={}, band={}, answered={}/{}, insights={}",
                catalog.revision(),
                scoring.overall().total(),
                scoring.overall().statusBand().getDisplayName(),
                scoring.questionsAnswered(),
                scoring.totalQuestions(),
                insights.size());

        return new AssessmentResult(scoring, insights);
    }

    public List<Question> questions(String catalogRevision, int dependents) {
        if (dependents < 0) {
            throw new IllegalArgumentException("dependents must be >= 0");
        }
        return catalogRegistry.resolve(catalogRevision).questionsFor(dependents);
    }

    public QuestionCatalogRegistry catalogs() {
        return catalogRegistry;
    }
}
