package com.finclinic.backend.dto.assessment;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CategoryScoreDTO {
    private BigDecimal score; // contribution to the overall score
    private int maxPossible; // category weight
    private BigDecimal percentage;
    private String statusLevel; // at_risk, good, excellent
}
