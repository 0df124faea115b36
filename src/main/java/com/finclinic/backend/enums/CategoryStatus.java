package com.finclinic.backend.enums;

public enum CategoryStatus {
    AT_RISK("at_risk"),
    GOOD("good"),
    EXCELLENT("excellent");

    private final String code;

    CategoryStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
