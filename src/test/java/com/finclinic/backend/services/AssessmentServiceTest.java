package com.finclinic.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.enums.IncomeBracket;
import com.finclinic.backend.enums.StatusBand;
import com.finclinic.backend.exceptions.BadRequestException;
import com.finclinic.backend.exceptions.CatalogInvariantException;
import com.finclinic.backend.services.catalog.FinancialClinicQuestions;
import com.finclinic.backend.services.catalog.LocalizedText;
import com.finclinic.backend.services.catalog.QuestionCatalog;
import com.finclinic.backend.services.catalog.QuestionCatalogRegistry;
import com.finclinic.backend.services.insights.ConditionTag;
import com.finclinic.backend.services.insights.Insight;
import com.finclinic.backend.services.insights.InsightSelector;
import com.finclinic.backend.services.scoring.CategoryScore;
import com.finclinic.backend.services.scoring.OverallScore;
import com.finclinic.backend.services.scoring.ScoreService;
import com.finclinic.backend.services.scoring.ScoringResult;

@ExtendWith(MockitoExtension.class)
class AssessmentServiceTest {

    @Mock
    private ScoreService scoreService;

    @Mock
    private InsightSelector insightSelector;

    private QuestionCatalog current;
    private QuestionCatalog legacy;
    private AssessmentService service;

    @BeforeEach
    void setUp() throws CatalogInvariantException {
        current = QuestionCatalog.initialize(FinancialClinicQuestions.CURRENT_REVISION, FinancialClinicQuestions.current());
        legacy = QuestionCatalog.initialize(FinancialClinicQuestions.LEGACY_REVISION, FinancialClinicQuestions.legacy());
        QuestionCatalogRegistry registry = new QuestionCatalogRegistry(List.of(current, legacy), "fc-15");
        service = new AssessmentService(registry, scoreService, insightSelector);
    }

    private static ScoringResult scoring(String revision) {
        Map<FinancialCategory, CategoryScore> scores = new EnumMap<>(FinancialCategory.class);
        for (FinancialCategory category : FinancialCategory.values()) {
            scores.put(category, new CategoryScore(category, 40, 50, 80.0, 8.0, 10, CategoryStatus.EXCELLENT));
        }
        return new ScoringResult(revision, new OverallScore(new BigDecimal("80.00"), StatusBand.EXCELLENT), scores, 14, 14);
    }

    @Test
    @DisplayName("Scores against the default catalog and selects insights for the profile")
    void assessUsesDefaultCatalog() {
        Map<String, Integer> answers = Map.of("fc_q1", 4);
        AssessmentProfile profile = new AssessmentProfile(IncomeBracket.ABOVE_100K, "Emirati", "Female", 0);
        ScoringResult scoring = scoring("fc-15");
        Insight insight = new Insight(FinancialCategory.INCOME_STREAM, CategoryStatus.EXCELLENT, ConditionTag.DEFAULT,
                LocalizedText.of("Keep it up", "استمر"), 1);

        when(scoreService.score(same(current), eq(answers), eq(0))).thenReturn(scoring);
        when(insightSelector.selectInsights(scoring.categoryScores(), profile)).thenReturn(List.of(insight));

        AssessmentResult result = service.assess(null, answers, profile);

        assertSame(scoring, result.scoring());
        assertEquals(List.of(insight), result.insights());
    }

    @Test
    @DisplayName("Passes the requested revision and dependents through to scoring")
    void assessUsesRequestedRevision() {
        AssessmentProfile profile = new AssessmentProfile(null, "Indian", "Male", 3);
        ScoringResult scoring = scoring("fc-16");
        when(scoreService.score(same(legacy), any(), eq(3))).thenReturn(scoring);
        when(insightSelector.selectInsights(any(), eq(profile))).thenReturn(List.of());

        service.assess("fc-16", Map.of(), profile);

        verify(scoreService).score(same(legacy), any(), eq(3));
    }

    @Test
    @DisplayName("Unknown revision is rejected before anything is scored")
    void unknownRevision() {
        AssessmentProfile profile = new AssessmentProfile(null, "Indian", "Male", 0);

        assertThrows(BadRequestException.class, () -> service.assess("fc-1", Map.of(), profile));

        verifyNoInteractions(scoreService, insightSelector);
    }

    @Test
    @DisplayName("Question listing hides the conditional question without dependents")
    void questions() {
        assertEquals(14, service.questions(null, 0).size());
        assertEquals(16, service.questions("fc-16", 1).size());
        assertThrows(IllegalArgumentException.class, () -> service.questions(null, -1));
        verify(scoreService, never()).score(any(), any(), anyInt());
    }
}
