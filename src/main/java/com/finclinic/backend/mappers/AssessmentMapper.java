package com.finclinic.backend.mappers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.finclinic.backend.dto.assessment.AssessmentResultDTO;
import com.finclinic.backend.dto.assessment.CategoryScoreDTO;
import com.finclinic.backend.dto.assessment.InsightDTO;
import com.finclinic.backend.dto.assessment.ProfileRequestDTO;
import com.finclinic.backend.dto.assessment.QuestionDTO;
import com.finclinic.backend.enums.IncomeBracket;
import com.finclinic.backend.exceptions.BadRequestException;
import com.finclinic.backend.services.AssessmentProfile;
import com.finclinic.backend.services.AssessmentResult;
import com.finclinic.backend.services.catalog.Question;
import com.finclinic.backend.services.insights.Insight;
import com.finclinic.backend.services.scoring.CategoryScore;
import com.finclinic.backend.services.scoring.ScoringResult;

public class AssessmentMapper {

    private AssessmentMapper() {}

    public static AssessmentProfile toProfile(ProfileRequestDTO dto) {
        IncomeBracket bracket = null;
        if (dto.incomeBracket() != null && !dto.incomeBracket().isBlank()) {
            bracket = IncomeBracket.fromValue(dto.incomeBracket())
                    .orElseThrow(() -> new BadRequestException("Unknown income bracket: " + dto.incomeBracket()));
        }
        return new AssessmentProfile(bracket, dto.nationality(), dto.gender(), dto.dependents());
    }

    public static AssessmentResultDTO toResultDTO(AssessmentResult result, String language) {
        ScoringResult scoring = result.scoring();

        Map<String, CategoryScoreDTO> categories = new LinkedHashMap<>();
        for (CategoryScore score : scoring.categoryScores().values()) {
            categories.put(score.category().getDisplayName(), toCategoryDTO(score));
        }

        List<InsightDTO> insights = result.insights().stream()
                .map(insight -> toInsightDTO(insight, language))
                .toList();

        return AssessmentResultDTO.builder()
                .catalogRevision(scoring.catalogRevision())
                .totalScore(scoring.overall().total())
                .statusBand(scoring.overall().statusBand().getDisplayName())
                .categoryScores(categories)
                .insights(insights)
                .questionsAnswered(scoring.questionsAnswered())
                .totalQuestions(scoring.totalQuestions())
                .build();
    }

    public static CategoryScoreDTO toCategoryDTO(CategoryScore score) {
        return CategoryScoreDTO.builder()
                .score(score.roundedContribution())
                .maxPossible(score.categoryWeight())
                .percentage(score.roundedPercentage())
                .statusLevel(score.statusLevel().getCode())
                .build();
    }

    public static InsightDTO toInsightDTO(Insight insight, String language) {
        return InsightDTO.builder()
                .category(insight.category().getDisplayName())
                .statusLevel(insight.statusLevel().getCode())
                .text(insight.text().en())
                .textLocalized(insight.text().resolve(language))
                .priority(insight.priority())
                .build();
    }

    public static QuestionDTO toQuestionDTO(Question question, String language) {
        boolean arabic = "ar".equalsIgnoreCase(language);
        return QuestionDTO.builder()
                .id(question.id())
                .number(question.number())
                .category(arabic ? question.category().getDisplayNameAr() : question.category().getDisplayName())
                .weight(question.weight())
                .text(question.text().resolve(language))
                .conditional(question.conditional())
                .options(question.options().stream()
                        .map(option -> new QuestionDTO.OptionDTO(option.value(), option.label().resolve(language)))
                        .toList())
                .build();
    }
}
