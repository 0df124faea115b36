package com.finclinic.backend.controllers;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.ObjectMapper;

@SpringBootTest
@AutoConfigureMockMvc
class FinancialClinicControllerIntegrationTest {

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private ObjectMapper objectMapper;

        private static Map<String, Integer> answers(int count, int value) {
                Map<String, Integer> answers = new LinkedHashMap<>();
                for (int i = 1; i <= count; i++) {
                        answers.put("fc_q" + i, value);
                }
                return answers;
        }

        private String body(Map<String, ?> answers, String incomeBracket, Object dependents) throws Exception {
                Map<String, Object> profile = new LinkedHashMap<>();
                profile.put("incomeBracket", incomeBracket);
                profile.put("nationality", "Emirati");
                profile.put("gender", "Female");
                profile.put("dependents", dependents);

                Map<String, Object> request = new LinkedHashMap<>();
                request.put("answers", answers);
                request.put("profile", profile);
                return objectMapper.writeValueAsString(request);
        }

        @Test
        void calculateReturnsScoreCategoriesAndInsights() throws Exception {
                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers(15, 4), "50K-100K", 2)))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.success").value(true))
                                .andExpect(jsonPath("$.data.catalogRevision").value("fc-15"))
                                .andExpect(jsonPath("$.data.totalScore").value(80.0))
                                .andExpect(jsonPath("$.data.statusBand").value("Excellent"))
                                .andExpect(jsonPath("$.data.categoryScores['Income Stream'].statusLevel").value("excellent"))
                                .andExpect(jsonPath("$.data.insights.length()").value(5))
                                .andExpect(jsonPath("$.data.insights[0].category").value("Protecting Your Family"))
                                .andExpect(jsonPath("$.data.questionsAnswered").value(15));
        }

        @Test
        void calculateWithoutDependentsSkipsConditionalQuestion() throws Exception {
                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .param("language", "ar")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers(14, 1), null, 0)))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.data.statusBand").value("At Risk"))
                                .andExpect(jsonPath("$.data.totalQuestions").value(14));
        }

        @Test
        void calculateReportsEveryInvalidAnswer() throws Exception {
                Map<String, Integer> answers = answers(15, 4);
                answers.remove("fc_q3");
                answers.put("fc_q5", 9);

                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers, "Below 5K", 1)))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.success").value(false))
                                .andExpect(jsonPath("$.message").value("Invalid assessment answers"))
                                .andExpect(jsonPath("$.errors.length()").value(2));
        }

        @Test
        void calculateRejectsUnknownIncomeBracketAndNegativeDependents() throws Exception {
                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers(14, 4), "millions", 0)))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.message").value("Unknown income bracket: millions"));

                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers(14, 4), null, -1)))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.message").value("Validation error"));
        }

        @Test
        void questionsFollowDependentsAndLanguage() throws Exception {
                mockMvc.perform(get("/api/financial-clinic/questions").param("dependents", "0"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.data.length()").value(14));

                mockMvc.perform(get("/api/financial-clinic/questions")
                                .param("dependents", "2")
                                .param("revision", "fc-16")
                                .param("language", "ar"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.data.length()").value(16))
                                .andExpect(jsonPath("$.data[0].category").value("مصدر الدخل"));

                mockMvc.perform(get("/api/financial-clinic/questions").param("revision", "fc-404"))
                                .andExpect(status().isBadRequest());
        }

        @Test
        void catalogsListsRevisions() throws Exception {
                mockMvc.perform(get("/api/financial-clinic/catalogs"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.data.defaultRevision").value("fc-15"))
                                .andExpect(jsonPath("$.data.revisions.length()").value(2));
        }

        @Test
        void calculateRejectsFractionalAndTextualAnswers() throws Exception {
                Map<String, Object> answers = new LinkedHashMap<>(answers(14, 4));
                answers.put("fc_q1", 5.9);
                answers.put("fc_q2", "4");

                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers, null, 0)))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.message").value("Invalid assessment answers"))
                                .andExpect(jsonPath("$.errors.length()").value(2))
                                .andExpect(jsonPath("$.errors[0]").value("Invalid answer value 5.9 for fc_q1. Must be an integer 1-5."))
                                .andExpect(jsonPath("$.errors[1]").value("Invalid answer value \"4\" for fc_q2. Must be an integer 1-5."));
        }

        @Test
        void calculateRejectsFractionalDependents() throws Exception {
                mockMvc.perform(post("/api/financial-clinic/calculate")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body(answers(15, 4), null, 2.5)))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.message").value("Malformed request body"));
        }
}
