package com.finclinic.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.finclinic.backend.dto.ApiResponse;
import com.finclinic.backend.dto.assessment.AssessmentResultDTO;
import com.finclinic.backend.dto.assessment.CalculateRequestDTO;
import com.finclinic.backend.dto.assessment.CatalogListDTO;
import com.finclinic.backend.dto.assessment.QuestionDTO;
import com.finclinic.backend.mappers.AssessmentMapper;
import com.finclinic.backend.services.AssessmentProfile;
import com.finclinic.backend.services.AssessmentResult;
import com.finclinic.backend.services.AssessmentService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/financial-clinic")
@RequiredArgsConstructor
public class FinancialClinicController {

    private final AssessmentService assessmentService;

    @GetMapping("/questions")
    public ResponseEntity<ApiResponse<List<QuestionDTO>>> getQuestions(
            @RequestParam(required = false) String revision,
            @RequestParam(defaultValue = "0") int dependents,
            @RequestParam(defaultValue = "en") String language
    ) {
        List<QuestionDTO> questions = assessmentService.questions(revision, dependents).stream()
                .map(q -> AssessmentMapper.toQuestionDTO(q, language))
                .toList();
        return ResponseEntity.ok(ApiResponse.success(questions, "Questions loaded successfully"));
    }

    @GetMapping("/catalogs")
    public ResponseEntity<ApiResponse<CatalogListDTO>> getCatalogs() {
        CatalogListDTO dto = new CatalogListDTO(
                assessmentService.catalogs().defaultCatalog().revision(),
                assessmentService.catalogs().revisions());
        return ResponseEntity.ok(ApiResponse.success(dto, "Catalogs loaded successfully"));
    }

    @PostMapping("/calculate")
    public ResponseEntity<ApiResponse<AssessmentResultDTO>> calculate(
            @Valid @RequestBody CalculateRequestDTO request,
            @RequestParam(defaultValue = "en") String language
    ) {
        AssessmentProfile profile = AssessmentMapper.toProfile(request.profile());
        AssessmentResult result = assessmentService.assess(request.catalogRevision(), request.answers(), profile);
        return ResponseEntity.ok(ApiResponse.success(AssessmentMapper.toResultDTO(result, language), "Assessment calculated successfully"));
    }
}
