package com.finclinic.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.finclinic.backend.services.catalog.FinancialClinicQuestions;

/**
 * Assessment settings, prefix "clinic.assessment".
 *
 * clinic.assessment.default-catalog-revision=fc-15
 * clinic.assessment.max-insights=5
 * clinic.assessment.local-nationality=Emirati
 * clinic.assessment.female-gender=Female
 */
@ConfigurationProperties(prefix = "clinic.assessment")
public record AssessmentProperties(
        String defaultCatalogRevision,
        Integer maxInsights,
        String localNationality,
        String femaleGender
) {
    public AssessmentProperties {
        if (defaultCatalogRevision == null || defaultCatalogRevision.isBlank()) {
            defaultCatalogRevision = FinancialClinicQuestions.CURRENT_REVISION;
        }
        if (maxInsights == null) {
            maxInsights = 5;
        }
        if (maxInsights < 0) {
            throw new IllegalArgumentException("clinic.assessment.max-insights must be >= 0");
        }
        if (localNationality == null || localNationality.isBlank()) {
            localNationality = "Emirati";
        }
        if (femaleGender == null || femaleGender.isBlank()) {
            femaleGender = "Female";
        }
    }

    public static AssessmentProperties defaults() {
        return new AssessmentProperties(null, null, null, null);
    }
}
