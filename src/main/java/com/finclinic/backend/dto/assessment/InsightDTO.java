package com.finclinic.backend.dto.assessment;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InsightDTO {
    private String category;
    private String statusLevel;
    private String text;
    private String textLocalized;
    private int priority;
}
