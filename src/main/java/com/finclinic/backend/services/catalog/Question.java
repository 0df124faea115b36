package com.finclinic.backend.services.catalog;

import java.util.List;

import com.finclinic.backend.enums.FinancialCategory;

/**
 * One assessment question. {@code weight} is the number of points (out of 100) the question
 * carries in the overall score when answered with the best option.
 */
public record Question(
        String id,
        int number,
        FinancialCategory category,
        int weight,
        LocalizedText text,
        List<AnswerOption> options,
        boolean conditional
) {
    public Question {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (category == null) throw new IllegalArgumentException("category is required");
        if (text == null) throw new IllegalArgumentException("text is required");
        options = options == null ? List.of() : List.copyOf(options);
    }
}
