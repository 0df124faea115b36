package com.finclinic.backend.services.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.FinancialCategory;

/**
 * @param actualPoints   sum of answer value x question weight
 * @param maxPoints      sum of 5 x question weight
 * @param percentage     actualPoints / maxPoints, 0..100
 * @param contribution   points added to the overall score, 0..categoryWeight
 * @param categoryWeight sum of the category's question weights
 */
public record CategoryScore(
        FinancialCategory category,
        int actualPoints,
        int maxPoints,
        double percentage,
        double contribution,
        int categoryWeight,
        CategoryStatus statusLevel
) {

    public BigDecimal roundedContribution() {
        return BigDecimal.valueOf(contribution).setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal roundedPercentage() {
        return BigDecimal.valueOf(percentage).setScale(2, RoundingMode.HALF_UP);
    }
}
