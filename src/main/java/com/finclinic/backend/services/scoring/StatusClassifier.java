package com.finclinic.backend.services.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.StatusBand;

/**
 * Maps scores to qualitative labels. Category and overall thresholds are intentionally
 * different scales.
 */
public final class StatusClassifier {

    private static final Logger log = LoggerFactory.getLogger(StatusClassifier.class);

    public static final double CATEGORY_EXCELLENT_THRESHOLD = 80.0;
    public static final double CATEGORY_GOOD_THRESHOLD = 40.0;

    private static final double MAX_TOTAL = 100.0;

    private StatusClassifier() {
    }

    public static CategoryStatus categoryStatus(double percentage) {
        if (percentage >= CATEGORY_EXCELLENT_THRESHOLD) return CategoryStatus.EXCELLENT;
        if (percentage >= CATEGORY_GOOD_THRESHOLD) return CategoryStatus.GOOD;
        return CategoryStatus.AT_RISK;
    }

    /**
     * Band for an overall score in [0, 100]. Anything outside that range has no band and is
     * reported as {@link StatusBand#AT_RISK}.
     */
    public static StatusBand overallBand(double total) {
        if (Double.isNaN(total) || total > MAX_TOTAL) {
            log.warn("Overall score {} is outside [0, 100]; falling back to {}", total, StatusBand.AT_RISK.getDisplayName());
            return StatusBand.AT_RISK;
        }
        for (StatusBand band : StatusBand.values()) {
            if (total >= band.getLowerBound()) {
                return band;
            }
        }
        log.warn("Overall score {} is outside [0, 100]; falling back to {}", total, StatusBand.AT_RISK.getDisplayName());
        return StatusBand.AT_RISK;
    }
}
