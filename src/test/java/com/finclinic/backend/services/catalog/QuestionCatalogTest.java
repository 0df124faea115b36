package com.finclinic.backend.services.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.exceptions.CatalogInvariantException;

class QuestionCatalogTest {

    @Test
    @DisplayName("Current catalog has 15 questions whose category weights add up to 100")
    void currentCatalogWeights() throws CatalogInvariantException {
        QuestionCatalog catalog = QuestionCatalog.initialize(FinancialClinicQuestions.CURRENT_REVISION, FinancialClinicQuestions.current());

        assertEquals(15, catalog.allQuestions().size());
        assertEquals(100, catalog.totalWeight());
        assertEquals(15, catalog.categoryWeight(FinancialCategory.INCOME_STREAM));
        assertEquals(20, catalog.categoryWeight(FinancialCategory.SAVINGS_HABIT));
        assertEquals(20, catalog.categoryWeight(FinancialCategory.EMERGENCY_SAVINGS));
        assertEquals(15, catalog.categoryWeight(FinancialCategory.DEBT_MANAGEMENT));
        assertEquals(20, catalog.categoryWeight(FinancialCategory.RETIREMENT_PLANNING));
        assertEquals(10, catalog.categoryWeight(FinancialCategory.PROTECTING_FAMILY));
        assertEquals("fc_q15", catalog.conditionalQuestionId().orElseThrow());
    }

    @Test
    @DisplayName("Legacy 16-question catalog is still a valid 100-point revision")
    void legacyCatalog() throws CatalogInvariantException {
        QuestionCatalog catalog = QuestionCatalog.initialize(FinancialClinicQuestions.LEGACY_REVISION, FinancialClinicQuestions.legacy());

        assertEquals(16, catalog.allQuestions().size());
        assertEquals(100, catalog.totalWeight());
        assertEquals(15, catalog.categoryWeight(FinancialCategory.EMERGENCY_SAVINGS));
        assertEquals(15, catalog.categoryWeight(FinancialCategory.PROTECTING_FAMILY));
        assertEquals("fc_q16", catalog.conditionalQuestionId().orElseThrow());

        Question estatePlanning = catalog.findQuestion("fc_q15").orElseThrow();
        assertEquals(FinancialCategory.PROTECTING_FAMILY, estatePlanning.category());
        assertEquals(5, estatePlanning.weight());
        assertFalse(estatePlanning.conditional());
        assertEquals(5, catalog.findQuestion("fc_q7").orElseThrow().weight());
    }

    @Test
    @DisplayName("Conditional question is only shown to respondents with dependents")
    void questionsForDependents() throws CatalogInvariantException {
        QuestionCatalog catalog = QuestionCatalog.initialize(FinancialClinicQuestions.CURRENT_REVISION, FinancialClinicQuestions.current());

        List<Question> noChildren = catalog.questionsFor(0);
        List<Question> withChildren = catalog.questionsFor(2);

        assertEquals(14, noChildren.size());
        assertFalse(noChildren.stream().anyMatch(q -> q.id().equals("fc_q15")));
        assertEquals(15, withChildren.size());
        assertEquals("fc_q15", withChildren.get(14).id());
    }

    @Test
    @DisplayName("Questions are kept in display order regardless of input order")
    void ordersByNumber() throws CatalogInvariantException {
        List<Question> shuffled = new ArrayList<>(FinancialClinicQuestions.current());
        Collections.reverse(shuffled);

        QuestionCatalog catalog = QuestionCatalog.initialize("shuffled", shuffled);

        for (int i = 0; i < catalog.allQuestions().size(); i++) {
            assertEquals(i + 1, catalog.allQuestions().get(i).number());
        }
        assertEquals(List.of("fc_q1", "fc_q2"), catalog.questionsIn(FinancialCategory.INCOME_STREAM).stream().map(Question::id).toList());
    }

    @Test
    @DisplayName("Refuses to initialise when weights do not sum to 100")
    void rejectsWrongWeightSum() {
        List<Question> questions = new ArrayList<>(FinancialClinicQuestions.current());
        Question q1 = questions.get(0);
        questions.set(0, new Question(q1.id(), q1.number(), q1.category(), 6, q1.text(), q1.options(), false));

        CatalogInvariantException ex = assertThrows(CatalogInvariantException.class,
                () -> QuestionCatalog.initialize("broken", questions));
        assertTrue(ex.getMessage().contains("sum to 100"));
        assertTrue(ex.getMessage().contains("101"));
    }

    @Test
    @DisplayName("Refuses duplicate ids, bad option sets, several conditionals and empty categories")
    void rejectsStructuralProblems() {
        List<Question> base = FinancialClinicQuestions.current();

        List<Question> duplicate = new ArrayList<>(base);
        Question q2 = duplicate.get(1);
        duplicate.set(1, new Question("fc_q1", q2.number(), q2.category(), q2.weight(), q2.text(), q2.options(), false));
        assertThrows(CatalogInvariantException.class, () -> QuestionCatalog.initialize("dup", duplicate));

        List<Question> fourOptions = new ArrayList<>(base);
        Question q3 = fourOptions.get(2);
        fourOptions.set(2, new Question(q3.id(), q3.number(), q3.category(), q3.weight(), q3.text(), q3.options().subList(0, 4), false));
        assertThrows(CatalogInvariantException.class, () -> QuestionCatalog.initialize("options", fourOptions));

        List<Question> twoConditionals = new ArrayList<>(base);
        Question q14 = twoConditionals.get(13);
        twoConditionals.set(13, new Question(q14.id(), q14.number(), q14.category(), q14.weight(), q14.text(), q14.options(), true));
        assertThrows(CatalogInvariantException.class, () -> QuestionCatalog.initialize("conditionals", twoConditionals));

        // debt questions moved to income: weights still 100 but one category is empty
        List<Question> emptyCategory = new ArrayList<>();
        for (Question q : base) {
            FinancialCategory category = q.category() == FinancialCategory.DEBT_MANAGEMENT ? FinancialCategory.INCOME_STREAM : q.category();
            emptyCategory.add(new Question(q.id(), q.number(), category, q.weight(), q.text(), q.options(), q.conditional()));
        }
        assertThrows(CatalogInvariantException.class, () -> QuestionCatalog.initialize("empty", emptyCategory));
    }

    @Test
    @DisplayName("Every question offers values 5 down to 1 with both languages")
    void optionsAreBilingual() {
        for (Question q : FinancialClinicQuestions.current()) {
            assertEquals(List.of(5, 4, 3, 2, 1), q.options().stream().map(AnswerOption::value).toList(), q.id());
            assertFalse(q.text().ar().isBlank(), q.id());
        }
    }
}
