package com.finclinic.backend.services.scoring;

import java.math.BigDecimal;

import com.finclinic.backend.enums.StatusBand;

public record OverallScore(BigDecimal total, StatusBand statusBand) {
}
