package com.finclinic.backend.services;

import com.finclinic.backend.enums.IncomeBracket;

/**
 * Respondent facts used for conditional scoring and insight selection.
 * {@code incomeBracket} may be null when the respondent did not disclose it.
 */
public record AssessmentProfile(
        IncomeBracket incomeBracket,
        String nationality,
        String gender,
        int dependents
) {
    public AssessmentProfile {
        if (dependents < 0) throw new IllegalArgumentException("dependents must be >= 0");
    }
}
