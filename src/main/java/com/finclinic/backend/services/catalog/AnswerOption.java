package com.finclinic.backend.services.catalog;

public record AnswerOption(int value, LocalizedText label) {

    public AnswerOption {
        if (label == null) throw new IllegalArgumentException("label is required");
    }

    public static AnswerOption of(int value, String en, String ar) {
        return new AnswerOption(value, LocalizedText.of(en, ar));
    }
}
