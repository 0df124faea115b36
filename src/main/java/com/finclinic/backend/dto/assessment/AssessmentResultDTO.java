package com.finclinic.backend.dto.assessment;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AssessmentResultDTO {
    private String catalogRevision;
    private BigDecimal totalScore;
    private String statusBand;
    private Map<String, CategoryScoreDTO> categoryScores;
    private List<InsightDTO> insights;
    private int questionsAnswered;
    private int totalQuestions;
}
