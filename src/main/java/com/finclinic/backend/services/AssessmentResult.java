package com.finclinic.backend.services;

import java.util.List;

import com.finclinic.backend.services.insights.Insight;
import com.finclinic.backend.services.scoring.ScoringResult;

public record AssessmentResult(ScoringResult scoring, List<Insight> insights) {

    public AssessmentResult {
        insights = List.copyOf(insights);
    }
}
