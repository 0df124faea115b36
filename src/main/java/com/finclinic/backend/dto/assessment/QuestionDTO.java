package com.finclinic.backend.dto.assessment;

import java.util.List;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QuestionDTO {
    private String id;
    private int number;
    private String category;
    private int weight;
    private String text;
    private boolean conditional;
    private List<OptionDTO> options;

    public record OptionDTO(int value, String label) {}
}
