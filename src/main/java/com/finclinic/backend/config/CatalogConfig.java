package com.finclinic.backend.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.finclinic.backend.exceptions.CatalogInvariantException;
import com.finclinic.backend.services.catalog.FinancialClinicQuestions;
import com.finclinic.backend.services.catalog.QuestionCatalog;
import com.finclinic.backend.services.catalog.QuestionCatalogRegistry;
import com.finclinic.backend.services.insights.FinancialClinicInsights;
import com.finclinic.backend.services.insights.InsightMatrix;

/**
 * Builds the question catalogs and the insight matrix once at startup. A content error surfaces
 * as a {@link CatalogInvariantException} and the application context fails to start.
 */
@Configuration
public class CatalogConfig {

    @Bean
    public QuestionCatalogRegistry questionCatalogRegistry(AssessmentProperties properties) throws CatalogInvariantException {
        List<QuestionCatalog> catalogs = List.of(
                QuestionCatalog.initialize(FinancialClinicQuestions.CURRENT_REVISION, FinancialClinicQuestions.current()),
                QuestionCatalog.initialize(FinancialClinicQuestions.LEGACY_REVISION, FinancialClinicQuestions.legacy())
        );
        return new QuestionCatalogRegistry(catalogs, properties.defaultCatalogRevision());
    }

    @Bean
    public InsightMatrix insightMatrix() throws CatalogInvariantException {
        return FinancialClinicInsights.matrix();
    }
}
