package com.finclinic.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import com.finclinic.backend.services.catalog.QuestionCatalog;
import com.finclinic.backend.services.catalog.QuestionCatalogRegistry;
import com.finclinic.backend.services.insights.InsightMatrix;

@Component
public class CatalogStartupValidation implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogStartupValidation.class);

    private final Environment environment;
    private final QuestionCatalogRegistry catalogRegistry;
    private final InsightMatrix insightMatrix;
    private final AssessmentProperties properties;

    public CatalogStartupValidation(
            Environment environment,
            QuestionCatalogRegistry catalogRegistry,
            InsightMatrix insightMatrix,
            AssessmentProperties properties
    ) {
        this.environment = environment;
        this.catalogRegistry = catalogRegistry;
        this.insightMatrix = insightMatrix;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String[] profiles = environment.getActiveProfiles();
        log.info("Active profiles: {}", profiles.length == 0 ? "(default)" : String.join(",", profiles));

        for (String revision : catalogRegistry.revisions()) {
            QuestionCatalog catalog = catalogRegistry.resolve(revision);
            log.info("Question catalog {} loaded: questions={}, totalWeight={}, conditional={}, categoryWeights={}",
                    catalog.revision(),
                    catalog.allQuestions().size(),
                    catalog.totalWeight(),
                    catalog.conditionalQuestionId().orElse("none"),
                    catalog.categoryWeights());
        }

        log.info("Default catalog revision: {}", catalogRegistry.defaultCatalog().revision());
        log.info("Insight matrix {} loaded: populatedBuckets={}, maxInsights={}",
                insightMatrix.version(),
                insightMatrix.populatedBuckets(),
                properties.maxInsights());
    }
}
