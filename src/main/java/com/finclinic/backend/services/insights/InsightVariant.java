package com.finclinic.backend.services.insights;

import com.finclinic.backend.services.catalog.LocalizedText;

public record InsightVariant(ConditionTag tag, LocalizedText text) {
}
